package com.geico.poc.faunasql.fql;

public interface ExprVisitor<R> {

    R visitLiteral(Literal literal);

    R visitArray(ArrayExpr array);

    R visitObject(ObjectExpr object);

    R visitVar(Var var);

    R visitLambda(Lambda lambda);

    R visitLet(Let let);

    R visitCall(Call call);
}

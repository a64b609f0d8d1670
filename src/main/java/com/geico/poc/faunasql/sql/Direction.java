package com.geico.poc.faunasql.sql;

public enum Direction {
    ASC,
    DESC
}

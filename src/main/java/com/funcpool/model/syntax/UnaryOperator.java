package com.funcpool.model.syntax;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum UnaryOperator {
    INVERT("~"),
    NOT("not"),
    PLUS("+"),
    MINUS("-");

    private final String symbol;
}

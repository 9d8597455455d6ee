package com.funcpool.model.syntax;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BoolOperator {
    AND("and"),
    OR("or");

    private final String symbol;
}

package com.funcpool.service.model;

import lombok.Value;

import java.util.List;

/**
 * A mapping matching a search. {@code matchedIn} names where: {@code name}, {@code docstring} or
 * {@code variables}.
 */
@Value
public class SearchHit {
    String hash;
    String language;
    String mappingHash;
    String functionName;
    List<String> matchedIn;
}

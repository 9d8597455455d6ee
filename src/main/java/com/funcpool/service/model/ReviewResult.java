package com.funcpool.service.model;

import lombok.Value;

import java.util.List;

/**
 * A function and its transitive dependencies, lowest level first. Items that could not be shown
 * are listed as warnings.
 */
@Value
public class ReviewResult {
    List<ReviewItem> items;
    List<String> warnings;
}

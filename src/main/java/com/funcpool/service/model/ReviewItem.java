package com.funcpool.service.model;

import lombok.Value;

@Value
public class ReviewItem {
    String hash;
    String language;
    String source;
}

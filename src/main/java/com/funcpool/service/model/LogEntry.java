package com.funcpool.service.model;

import lombok.Value;

import java.util.List;

@Value
public class LogEntry {
    String hash;
    String created;
    String author;
    List<String> languages;
}

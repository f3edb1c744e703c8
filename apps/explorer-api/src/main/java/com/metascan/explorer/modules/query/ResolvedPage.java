package com.metascan.explorer.modules.query;

import lombok.Value;

import java.util.List;

@Value
public class ResolvedPage<T> {
    List<T> items;
    long total;
    int number;
    int size;
    boolean searchIndexUsed;
}

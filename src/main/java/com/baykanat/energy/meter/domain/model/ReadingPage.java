package com.baykanat.energy.meter.domain.model;

import lombok.Value;

import java.util.List;

/** Sayfalanmış sorgu sonucu; totalCount raw modda satır, bucket modunda (bucket, tür) grubu sayısıdır. */
@Value
public class ReadingPage<T> {

    List<T> items;
    long totalCount;
}

package com.netflowradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Named monotonic counter (findAndModify + $inc). Id is the counter name, e.g. "transfers".
 */
@Document(collection = "counters")
@NoArgsConstructor
@Getter
@Setter
public class SequenceCounter {

    @Id
    private String id;
    private long value;
}

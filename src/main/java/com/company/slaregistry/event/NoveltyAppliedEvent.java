package com.company.slaregistry.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class NoveltyAppliedEvent {
    private final Long slaId;
    private final String field;
    private final String detail;
}

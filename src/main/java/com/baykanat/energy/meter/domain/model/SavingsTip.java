package com.baykanat.energy.meter.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SavingsTip {

    String title;
    String description;
    String potentialSavings;
}

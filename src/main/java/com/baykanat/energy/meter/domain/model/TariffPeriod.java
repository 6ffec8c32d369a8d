package com.baykanat.energy.meter.domain.model;

import lombok.Builder;
import lombok.Value;

/** Adlandırılmış fiyat kuralı: sınıf, görünen ad ve kWh başına birim fiyat. */
@Value
@Builder
public class TariffPeriod {

    TariffClass tariffClass;
    String name;
    String description;
    double rate;
}

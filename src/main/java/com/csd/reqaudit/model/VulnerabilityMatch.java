package com.csd.reqaudit.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class VulnerabilityMatch {

    @NonNull Requirement declared;

    @NonNull VulnerabilityRecord record;
}

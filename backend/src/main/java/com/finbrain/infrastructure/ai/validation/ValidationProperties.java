package com.finbrain.infrastructure.ai.validation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "finbrain.validation")
public class ValidationProperties {

    /** Largest accepted difference between a stated and a recomputed currency amount. */
    private BigDecimal amountTolerance = new BigDecimal("0.01");

    /** Largest accepted difference, in percentage points, for stated shares. */
    private BigDecimal percentTolerance = new BigDecimal("0.5");
}

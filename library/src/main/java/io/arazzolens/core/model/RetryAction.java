package io.arazzolens.core.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class RetryAction extends TransferAction {

    public static final int DEFAULT_RETRY_LIMIT = 1;

    // seconds
    private final BigDecimal retryAfter;
    @Builder.Default
    private final int retryLimit = DEFAULT_RETRY_LIMIT;

    @Override
    public ActionType getType() {
        return ActionType.RETRY;
    }
}

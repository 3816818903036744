package io.decaylite.engine.dto;

import java.math.BigInteger;

public class JsonPool {
    public long poolId;
    public BigInteger multiplier;
    public long maxLockDurationSeconds;
}

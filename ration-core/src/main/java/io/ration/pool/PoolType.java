package io.ration.pool;

import java.util.Locale;

/** Which bucket an allocation was drawn from. */
public enum PoolType {
    SHARED, RESERVED, DEDICATED;

    public String code() { return name().toLowerCase(Locale.ROOT); }
}

package com.funcpool.resolve;

import lombok.Value;

/**
 * A local alias of a dependency inside one unit. A deferred binding points to a function that was
 * still loading when the unit was linked, so the harness looks it up at call time.
 */
@Value
public class AliasBinding {
    String alias;
    String target;
    boolean deferred;
}

package com.jguard.filtering.list;

import java.util.function.Supplier;

/**
 * Creates the filter list implementation registered under a name.
 */
public interface FilterListFactory {

    String name();

    FilterList create();

    static FilterListFactory of(String name, Supplier<FilterList> supplier) {
        return new FilterListFactory() {
            @Override
            public String name() { return name; }

            @Override
            public FilterList create() { return supplier.get(); }
        };
    }
}

package com.kingsfoil.kingsfoil.source;

import java.util.List;

/**
 * Abstraction for obtaining the source configurations seeded at startup from any backing store.
 */
public interface SourceConfigLoader {

    List<DataSourceConfig> loadAll();
}

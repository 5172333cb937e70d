package com.kingsfoil.kingsfoil.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kingsfoil.kingsfoil.ingest.IngestProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads seed source configurations from classpath JSON documents matching
 * {@code kingsfoil.ingest.source-config-pattern}, one source per document.
 */
@Component
public class ClasspathSourceConfigLoader implements SourceConfigLoader {

    private final IngestProperties ingestProperties;
    private final ObjectMapper objectMapper;

    public ClasspathSourceConfigLoader(IngestProperties ingestProperties, ObjectMapper objectMapper) {
        this.ingestProperties = ingestProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<DataSourceConfig> loadAll() {
        String pattern = ingestProperties.getSourceConfigPattern();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath*:" + pattern);

            List<Resource> valid = new ArrayList<>();
            for (Resource resource : resources) {
                if (resource != null && resource.exists() && resource.getFilename() != null) {
                    valid.add(resource);
                }
            }
            valid.sort(Comparator.comparing(Resource::getFilename));

            List<DataSourceConfig> configs = new ArrayList<>(valid.size());
            for (Resource resource : valid) {
                try (InputStream in = resource.getInputStream()) {
                    configs.add(objectMapper.readValue(in, DataSourceConfig.class));
                } catch (IOException ex) {
                    throw new IllegalStateException(
                            SourceConstants.MSG_CONFIG_READ_FAILED.formatted(resource.getFilename()), ex);
                }
            }
            return configs;
        } catch (IOException ex) {
            throw new IllegalStateException(SourceConstants.MSG_CONFIG_READ_FAILED.formatted(pattern), ex);
        }
    }
}

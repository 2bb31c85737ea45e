package com.skein.eprints;

import com.skein.SkeinIndexerBase;
import com.skein.config.PipelineConfig;
import com.skein.dispatch.IndexingDomain;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for the eprint firehose indexer.
 *
 * <p>Usage:
 * <pre>
 *   java -jar skein-eprints.jar [config-path]
 * </pre>
 *
 * <p>If no config path is supplied, the default classpath resource
 * {@code pipeline-config.yaml} is used.</p>
 */
@Slf4j
public class EprintsIndexer extends SkeinIndexerBase {

    static final String DEFAULT_CONFIG = "pipeline-config.yaml";

    @Override
    protected String getDefaultConfigResource() {
        return DEFAULT_CONFIG;
    }

    @Override
    protected IndexingDomain createDomain(PipelineConfig config) {
        log.info("Indexing collections: {}", config.getCollections().isEmpty()
                ? "all registered eprint kinds" : config.getCollections());
        return new EprintsDomain();
    }

    public static void main(String[] args) throws Exception {
        new EprintsIndexer().run(args);
    }
}

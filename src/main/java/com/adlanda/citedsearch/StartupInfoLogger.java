package com.adlanda.citedsearch;

import com.adlanda.citedsearch.config.RetrievalProperties;
import com.adlanda.citedsearch.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after IngestionRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final VectorIndex vectorIndex;
    private final RetrievalProperties retrievalProperties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(VectorIndex vectorIndex, RetrievalProperties retrievalProperties) {
        this.vectorIndex = vectorIndex;
        this.retrievalProperties = retrievalProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Cited Search v{}
            Index: {} ({} lexical scoring), {} records

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/search
              POST http://localhost:{}/api/v1/answer
              POST http://localhost:{}/api/v1/answer/stream
              POST http://localhost:{}/api/v1/ingest
              GET  http://localhost:{}/api/v1/sources

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, retrievalProperties.getIndexType(), vectorIndex.lexicalSupport(), vectorIndex.size(),
            port, port, port, port, port, port, port
        );
    }
}

package com.containermgmt.querymonitor.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.function.Supplier;

/**
 * ActiveJDBC Database Configuration
 *
 * ActiveJDBC binds connections to the current thread, while the monitoring
 * loops run on scheduler threads. Every unit of work goes through
 * {@link #withConnection(Supplier)}, which borrows a connection from the
 * pooled DataSource only if the thread does not hold one already.
 */
@Configuration
@Slf4j
public class ActiveJDBCConfig {

    private final DataSource dataSource;

    public ActiveJDBCConfig(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    public void init() {
        log.info("ActiveJDBC configured on pooled DataSource ({})", dataSource.getClass().getSimpleName());
    }

    /**
     * Runs {@code work} with an ActiveJDBC connection attached to the current thread.
     * The connection is returned to the pool afterwards, unless it was already open.
     */
    public <T> T withConnection(Supplier<T> work) {
        boolean connectionOpened = false;
        try {
            if (!Base.hasConnection()) {
                Base.open(dataSource);
                connectionOpened = true;
            }
            return work.get();
        } finally {
            if (connectionOpened && Base.hasConnection()) {
                Base.close();
            }
        }
    }

    public void withConnection(Runnable work) {
        withConnection(() -> {
            work.run();
            return null;
        });
    }
}

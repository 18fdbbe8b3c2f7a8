package com.example.musiccatalog.api.command;

import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Lets picocli obtain command objects from the application context so they get their
 * services injected.
 */
@Component
public class SpringCommandFactory implements CommandLine.IFactory {

    private final ApplicationContext applicationContext;

    public SpringCommandFactory(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        K bean = applicationContext.getBeanProvider(cls).getIfAvailable();
        return bean != null ? bean : CommandLine.defaultFactory().create(cls);
    }
}

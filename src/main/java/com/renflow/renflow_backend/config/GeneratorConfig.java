package com.renflow.renflow_backend.config;

import com.renflow.renflow_backend.engine.ScriptFormat;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GeneratorConfig {

    @Value("${renflow.generator.header-title:" + ScriptFormat.DEFAULT_HEADER_TITLE + "}")
    private String headerTitle;

    @Value("${renflow.generator.header-notice:" + ScriptFormat.DEFAULT_HEADER_NOTICE + "}")
    private String headerNotice;

    @Value("${renflow.generator.entry-label:" + ScriptFormat.DEFAULT_ENTRY_LABEL + "}")
    private String entryLabel;

    @Bean
    public ScriptFormat scriptFormat() {
        return new ScriptFormat(headerTitle, headerNotice, entryLabel.trim());
    }
}

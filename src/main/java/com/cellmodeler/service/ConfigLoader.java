package com.cellmodeler.service;

import com.cellmodeler.language.ConfigParser;
import com.cellmodeler.language.Lexer;
import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.validation.ConfigValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text-to-config entry point: lexes, parses and validates in one call.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * @throws com.cellmodeler.language.LexException                 on a malformed token
     * @throws com.cellmodeler.language.ConfigParseException         on the first structural error
     * @throws com.cellmodeler.validation.ConfigValidationException  with every semantic error
     */
    public static AutomatonConfig load(String text) {
        AutomatonConfig config = new ConfigParser(new Lexer(text).tokenize()).parse();
        ConfigValidator.requireValid(config);
        log.debug("Loaded config {}x{} with {} states and {} rules",
                config.grid().width(),
                config.grid().height(),
                config.states().size(),
                config.rules().size());
        return config;
    }
}

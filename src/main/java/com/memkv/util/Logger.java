package com.memkv.util;

import org.slf4j.LoggerFactory;

public class Logger {
    private final org.slf4j.Logger logger;
    private final String tag;

    public Logger(Class<?> clazz, String tag) {
        this.logger = LoggerFactory.getLogger(clazz);
        this.tag = tag;
    }

    public void info(String format, Object... args) {
        logger.info("[" + tag + "] " + format, args);
    }

    public void warn(String format, Object... args) {
        logger.warn("[" + tag + "] " + format, args);
    }

    public void error(String format, Object... args) {
        logger.error("[" + tag + "] " + format, args);
    }

    public void debug(String format, Object... args) {
        logger.debug("[" + tag + "] " + format, args);
    }
}

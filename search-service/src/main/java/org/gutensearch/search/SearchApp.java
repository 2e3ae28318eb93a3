package org.gutensearch.search;

import org.gutensearch.search.bootstrap.SearchBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class SearchApp {
    private static final Logger logger = LoggerFactory.getLogger(SearchApp.class);

    public static void main(String[] args) {
        SearchBootstrap.run(parseArguments(args));
    }

    /**
     * Parse {@code --key value} command line arguments into configuration overrides
     */
    static Map<String, String> parseArguments(String[] args) {
        Map<String, String> overrides = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--") && i + 1 < args.length) {
                overrides.put(args[i].substring(2), args[i + 1]);
                logger.info("Command line argument: {} = {}", args[i].substring(2), args[i + 1]);
                i++;
            } else {
                logger.warn("Ignoring argument: {}", args[i]);
            }
        }
        return overrides;
    }
}

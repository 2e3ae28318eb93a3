package org.gutensearch.indexing;

import org.gutensearch.indexing.bootstrap.IndexingBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class IndexingApp {
	private static final Logger logger = LoggerFactory.getLogger(IndexingApp.class);

	public static void main(String[] args) {
		IndexingBootstrap.run(parseArguments(args));
	}

	/**
	 * Parse {@code --key value} command line arguments into configuration overrides
	 */
	static Map<String, String> parseArguments(String[] args) {
		Map<String, String> overrides = new LinkedHashMap<>();
		for (int i = 0; i < args.length; i++) {
			if (args[i].equals("-h") || args[i].equals("--help")) {
				printUsage();
				System.exit(0);
			} else if (args[i].startsWith("--") && i + 1 < args.length) {
				String key = args[i].substring(2);
				String value = args[i + 1];
				overrides.put(key, value);
				logger.info("Command line argument: {} = {}", key, value);
				i++;
			} else {
				logger.warn("Ignoring argument: {}", args[i]);
			}
		}
		return overrides;
	}

	/**
	 * Print usage information
	 */
	private static void printUsage() {
		System.out.println("\n=== Indexing Service Usage ===\n");
		System.out.println("Usage: java -jar indexing-service.jar [options]\n");
		System.out.println("Options:");
		System.out.println("  --storage.type <type>         Storage backend (default: hazelcast)");
		System.out.println("                                Options: hazelcast, postgresql, sqlite, mongodb");
		System.out.println("  --storage.jdbc.url <url>      JDBC URL for postgresql/sqlite");
		System.out.println("  --storage.mongodb.uri <uri>   MongoDB connection string");
		System.out.println("  --server.port <port>          Server port (default: 7002)");
		System.out.println("  --datalake.path <path>        Datalake path (default: ../datalake)");
		System.out.println("  --index.rebuild.on.empty <b>  Rebuild from the datalake when the index is empty");
		System.out.println("  -h, --help                    Show this help message\n");
		System.out.println("Examples:");
		System.out.println("  # Run with SQLite");
		System.out.println("  java -jar indexing-service.jar --storage.type sqlite\n");
		System.out.println("  # Run with PostgreSQL");
		System.out.println("  java -jar indexing-service.jar --storage.type postgresql --storage.jdbc.url jdbc:postgresql://localhost/search\n");
	}
}

package org.cellar.indexing;

import java.util.Properties;

import org.cellar.indexing.bootstrap.IndexingBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class IndexingApp {
	private static final Logger logger = LoggerFactory.getLogger(IndexingApp.class);

	public static void main(String[] args) {
		IndexingBootstrap.run(parseArguments(args));
	}

	/**
	 * Parse command line arguments of the form {@code --key value} into configuration overrides
	 */
	static Properties parseArguments(String[] args) {
		Properties overrides = new Properties();
		for (int i = 0; i < args.length; i++) {
			if (args[i].equals("-h") || args[i].equals("--help")) {
				printUsage();
				System.exit(0);
			} else if (args[i].startsWith("--") && i + 1 < args.length) {
				String key = args[i].substring(2);
				String value = args[i + 1];
				overrides.setProperty(key, value);
				logger.info("Command line argument: {} = {}", key, value);
				i++;
			}
		}
		return overrides;
	}

	/**
	 * Print usage information
	 */
	private static void printUsage() {
		System.out.println("\n=== Indexing Service Usage ===\n");
		System.out.println("Usage: java -jar indexing-service-1.0.0.jar [options]\n");
		System.out.println("Options (any application.properties key can be overridden):");
		System.out.println("  --server.port <port>            Server port (default: 7002)");
		System.out.println("  --vocabulary.jdbc.url <url>     Vocabulary database (default: SQLite under ../datamart)");
		System.out.println("  --mirror.index.path <path>      Mirror index directory (default: ../datamart/mirror-index)");
		System.out.println("  --mirror.update.mode <mode>     direct, executor or jms (default: executor)");
		System.out.println("  --mirror.batch.size <n>         Records per mirror bulk request (default: 500)");
		System.out.println("  -h, --help                      Show this help message\n");
		System.out.println("Examples:");
		System.out.println("  # Run with PostgreSQL vocabulary");
		System.out.println("  java -jar indexing-service-1.0.0.jar --vocabulary.jdbc.url jdbc:postgresql://localhost:5432/cellar\n");
		System.out.println("  # Queue mirror updates through ActiveMQ");
		System.out.println("  java -jar indexing-service-1.0.0.jar --mirror.update.mode jms --activemq.broker.url tcp://localhost:61616\n");
	}
}

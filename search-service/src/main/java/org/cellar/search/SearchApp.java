package org.cellar.search;

import java.util.Properties;

import org.cellar.search.bootstrap.SearchBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SearchApp {
	private static final Logger logger = LoggerFactory.getLogger(SearchApp.class);

	public static void main(String[] args) {
		SearchBootstrap.run(parseArguments(args));
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

	private static void printUsage() {
		System.out.println("\n=== Search Service Usage ===\n");
		System.out.println("Usage: java -jar search-service-1.0.0.jar [options]\n");
		System.out.println("Options (any application.properties key can be overridden):");
		System.out.println("  --server.port <port>              Server port (default: 7003)");
		System.out.println("  --search.default.source <source>  primary or mirror (default: primary)");
		System.out.println("  --search.mirror.fallback <bool>   Answer from the primary index when the mirror is down (default: true)");
		System.out.println("  --mirror.index.path <path>        Mirror index directory written by the Indexing Service");
		System.out.println("  -h, --help                        Show this help message\n");
		System.out.println("Examples:");
		System.out.println("  curl 'http://localhost:7003/search?q=cherry+tannins&country=Italy&points=90..&highlight=true'");
		System.out.println("  curl 'http://localhost:7003/suggest?q=cabernay&source=mirror'\n");
	}
}

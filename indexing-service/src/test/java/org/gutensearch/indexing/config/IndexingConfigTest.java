package org.gutensearch.indexing.config;

import org.gutensearch.core.storage.StorageSettings;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingConfigTest {

	private static Properties base() {
		Properties p = new Properties();
		p.setProperty("server.port", "7002");
		p.setProperty("datalake.path", "../datalake");
		return p;
	}

	@Test
	public void testDefaults() {
		IndexingConfig cfg = IndexingConfig.from(base());

		assertEquals(7002, cfg.serverPort());
		assertEquals("../datalake", cfg.datalake().path());
		assertEquals("downloaded_books.txt", cfg.datalake().trackingFilename());
		assertEquals(StorageSettings.Type.HAZELCAST, cfg.storage().type());
		assertFalse(cfg.rebuildOnEmpty());
	}

	@Test
	public void testDeploymentAliasesWin() {
		Properties p = base();
		p.setProperty("PORT", "8080");
		p.setProperty("BACKEND_TYPE", "postgres");
		p.setProperty("DATABASE_URL", "jdbc:postgresql://db:5432/search");
		p.setProperty("DATA_VOLUME_PATH", "/data/datalake");
		p.setProperty("index.rebuild.on.empty", "true");

		IndexingConfig cfg = IndexingConfig.from(p);

		assertEquals(8080, cfg.serverPort());
		assertEquals(StorageSettings.Type.POSTGRESQL, cfg.storage().type());
		assertEquals("jdbc:postgresql://db:5432/search", cfg.storage().jdbc().url());
		assertEquals("/data/datalake", cfg.datalake().path());
		assertTrue(cfg.rebuildOnEmpty());
	}

	@Test
	public void testMongoUriAlias() {
		Properties p = base();
		p.setProperty("BACKEND_TYPE", "mongodb");
		p.setProperty("MONGODB_URI", "mongodb://mongo:27017");

		assertEquals("mongodb://mongo:27017", IndexingConfig.from(p).storage().mongo().uri());
	}

	@Test
	public void testMissingRequiredKeysFailFast() {
		Properties noPort = base();
		noPort.remove("server.port");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(noPort));

		Properties noDatalake = base();
		noDatalake.remove("datalake.path");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(noDatalake));

		Properties badPort = base();
		badPort.setProperty("PORT", "http");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(badPort));
	}
}

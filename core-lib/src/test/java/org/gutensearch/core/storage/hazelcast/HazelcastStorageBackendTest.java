package org.gutensearch.core.storage.hazelcast;

import com.hazelcast.config.Config;
import com.hazelcast.config.JoinConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.gutensearch.core.storage.StorageBackend;
import org.gutensearch.core.storage.StorageBackendContract;
import org.gutensearch.core.storage.StorageConnectionException;
import org.gutensearch.core.storage.StorageSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class HazelcastStorageBackendTest extends StorageBackendContract {

	private HazelcastInstance instance;

	@Override
	protected StorageBackend createBackend() {
		StorageSettings.Hazelcast settings = new StorageSettings.Hazelcast(
				StorageSettings.HazelcastMode.MEMBER,
				"test-" + UUID.randomUUID(),
				5701,
				List.of(),
				0,
				0,
				"127.0.0.1",
				List.of("127.0.0.1"),
				"book-metadata",
				"inverted-index",
				Duration.ofSeconds(5)
		);

		// Standalone member: no discovery, any free port.
		Config config = HazelcastConfigFactory.build(settings, Duration.ofSeconds(5));
		config.getNetworkConfig().setPortAutoIncrement(true).setPortCount(200);
		JoinConfig join = config.getNetworkConfig().getJoin();
		join.getTcpIpConfig().setEnabled(false);
		join.getMulticastConfig().setEnabled(false);
		join.getAutoDetectionConfig().setEnabled(false);
		config.getNetworkConfig().setPublicAddress(null);

		instance = Hazelcast.newHazelcastInstance(config);
		return new HazelcastStorageBackend(instance, settings.metadataMapName(), settings.invertedIndexName());
	}

	@Test
	public void testConnectionFailsAfterShutdown() {
		instance.shutdown();

		assertThrows(StorageConnectionException.class, () -> backend.testConnection());
		assertEquals("hazelcast", backend.name());
	}
}

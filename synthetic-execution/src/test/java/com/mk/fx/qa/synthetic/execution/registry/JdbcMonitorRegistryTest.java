package com.mk.fx.qa.synthetic.execution.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.synthetic.execution.model.Monitor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

class JdbcMonitorRegistryTest {

  private EmbeddedDatabase database;
  private JdbcMonitorRegistry registry;

  @BeforeEach
  void setUp() {
    database =
        new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .generateUniqueName(true)
            .addScript("schema-h2.sql")
            .build();
    var jdbcTemplate = new JdbcTemplate(database);
    jdbcTemplate.update(
        "INSERT INTO monitors (id, name, url, enabled, timeout_seconds) VALUES"
            + " (3, 'checkout', 'https://example.com/checkout', TRUE, 45),"
            + " (1, 'home', 'https://example.com', TRUE, 30),"
            + " (2, 'legacy', 'https://old.example.com', FALSE, 10)");
    registry = new JdbcMonitorRegistry(jdbcTemplate);
  }

  @AfterEach
  void tearDown() {
    database.shutdown();
  }

  @Test
  void listEnabledMonitors_onlyEnabledOrderedById() {
    var monitors = registry.listEnabledMonitors();

    assertEquals(2, monitors.size());
    assertEquals(new Monitor(1, "home", "https://example.com", 30, true), monitors.get(0));
    assertEquals(3, monitors.get(1).id());
    assertEquals(45, monitors.get(1).timeoutSeconds());
  }

  @Test
  void getMonitor_findsDisabledMonitorsToo() {
    var legacy = registry.getMonitor(2);

    assertTrue(legacy.isPresent());
    assertFalse(legacy.get().enabled());
    assertTrue(registry.getMonitor(99).isEmpty());
  }
}

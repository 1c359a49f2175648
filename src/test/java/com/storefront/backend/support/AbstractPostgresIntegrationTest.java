package com.storefront.backend.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.junit.jupiter.api.AfterEach;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway migrates the schema on context
 * start-up and every table is truncated after each test. Outgoing mail is captured instead of sent.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("storefront_test")
            .withUsername("storefront")
            .withPassword("storefront");

    private static final Pattern TOKEN_PATTERN = Pattern.compile("token=([0-9a-f]+)");

    static {
        // one container per JVM so cached Spring contexts keep a valid datasource
        if (DockerClientFactory.instance().isDockerAvailable()) {
            POSTGRES.start();
        }
    }

    @MockBean
    protected JavaMailSender mailSender;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    /**
     * @return the token embedded in the most recent mail sent to {@code recipient}
     */
    protected String lastMailedToken(String recipient) {
        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender, atLeastOnce()).send(captor.capture());
        List<SimpleMailMessage> toRecipient = captor.getAllValues().stream()
                .filter(message -> message.getTo() != null && List.of(message.getTo()).contains(recipient))
                .toList();
        assertThat(toRecipient).as("mail sent to %s", recipient).isNotEmpty();

        Matcher matcher = TOKEN_PATTERN.matcher(toRecipient.get(toRecipient.size() - 1).getText());
        assertThat(matcher.find()).as("mail contains a token link").isTrue();
        return matcher.group(1);
    }

    @AfterEach
    void truncateTables() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("TRUNCATE TABLE audit_log, password_reset_token, refresh_token, pre_registration, app_user CASCADE");
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to truncate tables after test", ex);
        }
    }
}

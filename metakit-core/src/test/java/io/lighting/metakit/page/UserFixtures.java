package io.lighting.metakit.page;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.UUID;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;

/**
 * H2 users table shared by the paginator tests. Ids follow insertion order.
 */
final class UserFixtures {
    static final String[][] USERS = {
        { "John Doe", "john@example.com", "30" },
        { "Jane Smith", "jane@example.com", "25" },
        { "Bob Johnson", "bob@example.com", "35" },
        { "Alice Brown", "alice@example.com", "28" },
        { "Charlie Wilson", "charlie@example.com", "32" }
    };

    private UserFixtures() {
    }

    static DataSource seededDataSource() throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:metakit_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("sa");
        try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
            statement.execute(
                "CREATE TABLE users ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "name VARCHAR(64) NOT NULL, "
                    + "email VARCHAR(128) NOT NULL, "
                    + "age INT NOT NULL, "
                    + "created_at TIMESTAMP NOT NULL)"
            );
        }
        LocalDateTime base = LocalDateTime.of(2024, 1, 1, 9, 0);
        try (Connection connection = dataSource.getConnection();
             PreparedStatement insert = connection.prepareStatement(
                 "INSERT INTO users (name, email, age, created_at) VALUES (?, ?, ?, ?)"
             )) {
            for (int i = 0; i < USERS.length; i++) {
                insert.setString(1, USERS[i][0]);
                insert.setString(2, USERS[i][1]);
                insert.setInt(3, Integer.parseInt(USERS[i][2]));
                insert.setTimestamp(4, Timestamp.valueOf(base.plusDays(i)));
                insert.executeUpdate();
            }
        }
        return dataSource;
    }

    record User(long id, String name, String email, int age) {
    }
}

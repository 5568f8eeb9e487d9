package com.infomedia.abacox.nation.component.seed;

import jakarta.persistence.Column;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Table;
import org.hibernate.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes seed entities into their table keeping the ids they were authored with.
 * Entity ids are sequence generated, so a plain persist would replace them; rows are
 * inserted with native SQL built from the {@link Column} mappings instead.
 */
@Component
public class SeedDatabaseLoader {

    private static final Logger log = LoggerFactory.getLogger(SeedDatabaseLoader.class);
    private static final int DEFAULT_BATCH_SIZE = 100;

    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;

    @Autowired
    public SeedDatabaseLoader(EntityManager entityManager, PlatformTransactionManager transactionManager) {
        this.entityManager = entityManager;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Inserts the given entities, ids included, in a single transaction.
     *
     * @param entities    fully constructed entities with assigned ids
     * @param entityClass the mapped entity class
     * @return number of inserted rows
     */
    public <E> int insertForcingIds(List<E> entities, Class<E> entityClass) {
        if (entities.isEmpty()) {
            return 0;
        }
        final String tableName = tableName(entityClass);
        final List<Field> columns = insertableColumns(entityClass);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No insertable columns mapped on " + entityClass.getName());
        }

        final String sql = "INSERT INTO " + tableName + " ("
                + columns.stream().map(SeedDatabaseLoader::columnName).collect(Collectors.joining(", "))
                + ") VALUES ("
                + columns.stream().map(field -> "?").collect(Collectors.joining(", "))
                + ")";
        log.debug("Seed insert statement: {}", sql);

        Integer inserted = transactionTemplate.execute(status -> {
            Session session = entityManager.unwrap(Session.class);
            return session.doReturningWork(connection -> {
                int count = 0;
                try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                    for (E entity : entities) {
                        int paramIndex = 1;
                        for (Field field : columns) {
                            setStatementParameter(stmt, paramIndex++, readField(field, entity));
                        }
                        stmt.addBatch();
                        count++;

                        if (count % DEFAULT_BATCH_SIZE == 0) {
                            stmt.executeBatch();
                            log.info("Processed {} records", count);
                        }
                    }
                    stmt.executeBatch();
                }
                return count;
            });
        });

        int total = inserted == null ? 0 : inserted;
        log.info("Inserted {} rows into {}", total, tableName);
        return total;
    }

    private String tableName(Class<?> entityClass) {
        Table table = entityClass.getAnnotation(Table.class);
        if (table != null && !table.name().isEmpty()) {
            return table.name();
        }
        return entityClass.getSimpleName();
    }

    /**
     * Gets the {@link Column} mapped fields of a class and its superclasses that take part
     * in inserts, in declaration order.
     */
    private List<Field> insertableColumns(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        Class<?> current = type;
        while (current != null && !current.equals(Object.class)) {
            for (Field field : current.getDeclaredFields()) {
                Column column = field.getAnnotation(Column.class);
                if (column == null || !column.insertable() || Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                field.setAccessible(true);
                fields.add(field);
            }
            current = current.getSuperclass();
        }
        return fields;
    }

    private static String columnName(Field field) {
        Column column = field.getAnnotation(Column.class);
        return column.name().isEmpty() ? field.getName() : column.name();
    }

    private static Object readField(Field field, Object entity) {
        try {
            return field.get(entity);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + field.getName() + " of " + entity, e);
        }
    }

    private static void setStatementParameter(PreparedStatement stmt, int paramIndex, Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(paramIndex, Types.NULL);
        } else if (value instanceof String) {
            stmt.setString(paramIndex, (String) value);
        } else if (value instanceof Integer) {
            stmt.setInt(paramIndex, (Integer) value);
        } else if (value instanceof Enum) {
            stmt.setString(paramIndex, ((Enum<?>) value).name());
        } else {
            stmt.setObject(paramIndex, value);
        }
    }
}

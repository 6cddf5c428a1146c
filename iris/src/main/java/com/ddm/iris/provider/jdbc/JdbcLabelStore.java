package com.ddm.iris.provider.jdbc;

import com.ddm.iris.defined.InterfaceType;
import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.defined.VariantSlot;
import com.ddm.iris.provider.LabelStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 基于 JDBC 的标签存储实现。
 *
 * <p>从关系型数据库（MySQL、H2 等）中读写标签数据。
 *
 * <h3>i18n_label 表（标签）</h3>
 * <pre>{@code
 * CREATE TABLE i18n_label (
 *   id             BIGINT AUTO_INCREMENT PRIMARY KEY,
 *   namespace      VARCHAR(128) NOT NULL,
 *   label_key      VARCHAR(255) NOT NULL,
 *   category       VARCHAR(128),
 *   default_locale VARCHAR(35)  NOT NULL,
 *   default_text   TEXT         NOT NULL,
 *   updated_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
 *   created_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
 *   UNIQUE KEY uk_label (namespace, label_key)
 * );
 * }</pre>
 *
 * <h3>i18n_label_variant 表（本地化变体）</h3>
 * <pre>{@code
 * CREATE TABLE i18n_label_variant (
 *   id             BIGINT AUTO_INCREMENT PRIMARY KEY,
 *   namespace      VARCHAR(128) NOT NULL,
 *   label_key      VARCHAR(255) NOT NULL,
 *   locale         VARCHAR(35)  NOT NULL,
 *   connector_type VARCHAR(64)  NOT NULL DEFAULT '',  -- '' 表示所有渠道
 *   interface_type VARCHAR(16)  NOT NULL DEFAULT '',  -- '' 表示所有模态
 *   alternatives   TEXT         NOT NULL,             -- JSON 数组，如 ["Hi!", "Hello!"]
 *   validated      BOOLEAN      DEFAULT FALSE,
 *   updated_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
 *   UNIQUE KEY uk_variant (namespace, label_key, locale, connector_type, interface_type)
 * );
 * }</pre>
 *
 * <p><strong>配置参数：</strong>
 * <ul>
 *   <li>{@code url}（必需）：JDBC 连接 URL</li>
 *   <li>{@code username}、{@code password}（可选）：默认为空字符串</li>
 *   <li>{@code init_sql}（可选）：为 {@code "true"}/{@code "1"}/{@code "yes"}/{@code "on"} 时自动建表，默认不建表</li>
 * </ul>
 *
 * <p><strong>并发写入：</strong>首次创建依赖 {@code uk_label} 唯一约束，
 * 插入冲突说明其他实例已写入，此时重新读取并返回已存在的标签。
 *
 * @author liyifei
 * @see LabelStore
 * @since 1.0
 */
public class JdbcLabelStore implements LabelStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcLabelStore.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final TypeReference<List<String>> ALTERNATIVES = new TypeReference<>() {
    };

    /**
     * 缺省渠道/模态在库中的占位值，保证唯一约束生效
     */
    private static final String ANY = "";

    private NamedParameterJdbcTemplate jdbc;

    private TransactionTemplate tx;

    @Override
    public String type() {
        return "jdbc";
    }

    /**
     * 获取 JDBC 数据源（用于测试和调试）。
     *
     * @return 数据源实例，如果未初始化则返回 null
     */
    public DataSource getDataSource() {
        return jdbc != null ? jdbc.getJdbcTemplate().getDataSource() : null;
    }

    @Override
    public void init(Map<String, String> options) {
        Map<String, String> cfg = Objects.requireNonNull(options, "options must not be null");
        String url = must(cfg, "url");
        String username = cfg.getOrDefault("username", "");
        String password = cfg.getOrDefault("password", "");
        try {
            DataSource ds = new DriverManagerDataSource(url, username, password);
            this.jdbc = new NamedParameterJdbcTemplate(ds);
            this.tx = new TransactionTemplate(new DataSourceTransactionManager(ds));
        } catch (Exception e) {
            log.error("Failed to initialize JDBC data source", e);
            throw new IllegalStateException("Failed to initialize JDBC data source for url: " + maskPassword(url), e);
        }
        boolean initSql = switch (cfg.getOrDefault("init_sql", "").trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            default -> false;
        };
        if (initSql) {
            ensureTables();
        }
        log.info("JdbcLabelStore initialized: url={}", maskPassword(url));
    }

    @Override
    public Label getLabel(LabelRef ref) {
        checkInitialized();
        String sql = """
                SELECT namespace, label_key, category, default_locale, default_text
                FROM i18n_label
                WHERE namespace = :namespace AND label_key = :key
                """;
        try {
            List<Label> rows = jdbc.query(sql, refParams(ref), this::mapLabel);
            if (rows.isEmpty()) {
                log.trace("Label not found in database: {}", ref);
                return null;
            }
            Label label = rows.get(0);
            return new Label(label.ref(), label.category(), label.defaultLocale(), label.defaultText(), loadVariants(ref));
        } catch (DataAccessException e) {
            log.error("Database error while loading label: {}", ref, e);
            throw new IllegalStateException("Failed to load label from database: " + ref, e);
        }
    }

    @Override
    public Label upsertIfAbsent(Label label) {
        checkInitialized();
        Objects.requireNonNull(label, "label");
        Label existing = getLabel(label.ref());
        if (existing != null) {
            return existing;
        }
        try {
            tx.executeWithoutResult(status -> {
                insertLabel(label);
                for (LocalizedLabel v : label.variants()) {
                    insertVariant(label.ref(), v);
                }
            });
            log.debug("Created label {} (defaultLocale={})", label.ref(), label.defaultLocale());
            return label;
        } catch (DuplicateKeyException e) {
            // 并发写入方已创建，使用其结果
            log.debug("Concurrent creation detected for label {}, reading stored entry", label.ref());
            Label stored = getLabel(label.ref());
            if (stored == null) {
                throw new IllegalStateException("Label creation conflicted but no stored entry found: " + label.ref(), e);
            }
            return stored;
        } catch (DataAccessException e) {
            log.error("Database error while creating label: {}", label.ref(), e);
            throw new IllegalStateException("Failed to create label in database: " + label.ref(), e);
        }
    }

    @Override
    public LocalizedLabel findVariant(LabelRef ref, VariantSlot slot) {
        checkInitialized();
        String sql = """
                SELECT locale, connector_type, interface_type, alternatives, validated
                FROM i18n_label_variant
                WHERE namespace = :namespace AND label_key = :key
                  AND locale = :locale AND connector_type = :connectorType AND interface_type = :interfaceType
                """;
        try {
            List<LocalizedLabel> rows = jdbc.query(sql, slotParams(ref, slot), this::mapVariant);
            return rows.isEmpty() ? null : rows.get(0);
        } catch (DataAccessException e) {
            log.error("Database error while loading variant {} of label {}", slot, ref, e);
            throw new IllegalStateException("Failed to load variant from database: " + ref + " " + slot, e);
        }
    }

    @Override
    public void saveVariant(LabelRef ref, LocalizedLabel variant) {
        checkInitialized();
        Objects.requireNonNull(variant, "variant");
        try {
            tx.executeWithoutResult(status -> {
                Integer count = jdbc.queryForObject(
                        "SELECT COUNT(*) FROM i18n_label WHERE namespace = :namespace AND label_key = :key",
                        refParams(ref), Integer.class);
                if (count == null || count == 0) {
                    throw new IllegalStateException("Label not found: " + ref);
                }
                if (updateVariant(ref, variant) == 0) {
                    insertVariant(ref, variant);
                }
            });
            log.debug("Saved variant {} of label {}", variant.slot(), ref);
        } catch (DataAccessException e) {
            log.error("Database error while saving variant {} of label {}", variant.slot(), ref, e);
            throw new IllegalStateException("Failed to save variant in database: " + ref + " " + variant.slot(), e);
        }
    }

    @Override
    public void saveLabel(Label label) {
        checkInitialized();
        Objects.requireNonNull(label, "label");
        try {
            tx.executeWithoutResult(status -> {
                int updated = jdbc.update("""
                        UPDATE i18n_label
                        SET category = :category, default_locale = :defaultLocale, default_text = :defaultText,
                            updated_at = CURRENT_TIMESTAMP
                        WHERE namespace = :namespace AND label_key = :key
                        """, labelParams(label));
                if (updated == 0) {
                    insertLabel(label);
                }
                jdbc.update("DELETE FROM i18n_label_variant WHERE namespace = :namespace AND label_key = :key",
                        refParams(label.ref()));
                for (LocalizedLabel v : label.variants()) {
                    insertVariant(label.ref(), v);
                }
            });
            log.debug("Saved label {} ({} variants)", label.ref(), label.variants().size());
        } catch (DataAccessException e) {
            log.error("Database error while saving label {}", label.ref(), e);
            throw new IllegalStateException("Failed to save label in database: " + label.ref(), e);
        }
    }

    /**
     * 在事务中锁定标签行后检查默认变体的校验状态，只更新默认文案与默认变体。
     */
    @Override
    public boolean replaceDefaultText(LabelRef ref, String defaultText) {
        checkInitialized();
        Objects.requireNonNull(defaultText, "defaultText");
        try {
            Boolean replaced = tx.execute(status -> {
                List<String> locales = jdbc.queryForList("""
                        SELECT default_locale FROM i18n_label
                        WHERE namespace = :namespace AND label_key = :key
                        FOR UPDATE
                        """, refParams(ref), String.class);
                if (locales.isEmpty()) {
                    throw new IllegalStateException("Label not found: " + ref);
                }
                Locale defaultLocale = Locale.forLanguageTag(locales.get(0));
                LocalizedLabel current = findVariant(ref, VariantSlot.of(defaultLocale));
                if (current != null && current.validated()) {
                    return false;
                }
                jdbc.update("""
                        UPDATE i18n_label
                        SET default_text = :defaultText, updated_at = CURRENT_TIMESTAMP
                        WHERE namespace = :namespace AND label_key = :key
                        """, refParams(ref).addValue("defaultText", defaultText));
                LocalizedLabel variant = LocalizedLabel.unvalidated(defaultLocale, defaultText);
                if (updateVariant(ref, variant) == 0) {
                    insertVariant(ref, variant);
                }
                return true;
            });
            boolean result = Boolean.TRUE.equals(replaced);
            log.debug("Default text of label {} {}", ref, result ? "replaced" : "kept (validated)");
            return result;
        } catch (DataAccessException e) {
            log.error("Database error while replacing default text of label {}", ref, e);
            throw new IllegalStateException("Failed to replace default text in database: " + ref, e);
        }
    }

    private List<LocalizedLabel> loadVariants(LabelRef ref) {
        String sql = """
                SELECT locale, connector_type, interface_type, alternatives, validated
                FROM i18n_label_variant
                WHERE namespace = :namespace AND label_key = :key
                ORDER BY id
                """;
        return jdbc.query(sql, refParams(ref), this::mapVariant);
    }

    private void insertLabel(Label label) {
        jdbc.update("""
                INSERT INTO i18n_label (namespace, label_key, category, default_locale, default_text)
                VALUES (:namespace, :key, :category, :defaultLocale, :defaultText)
                """, labelParams(label));
    }

    private void insertVariant(LabelRef ref, LocalizedLabel variant) {
        jdbc.update("""
                INSERT INTO i18n_label_variant
                    (namespace, label_key, locale, connector_type, interface_type, alternatives, validated)
                VALUES (:namespace, :key, :locale, :connectorType, :interfaceType, :alternatives, :validated)
                """, variantParams(ref, variant));
    }

    private int updateVariant(LabelRef ref, LocalizedLabel variant) {
        return jdbc.update("""
                UPDATE i18n_label_variant
                SET alternatives = :alternatives, validated = :validated, updated_at = CURRENT_TIMESTAMP
                WHERE namespace = :namespace AND label_key = :key
                  AND locale = :locale AND connector_type = :connectorType AND interface_type = :interfaceType
                """, variantParams(ref, variant));
    }

    private Label mapLabel(ResultSet rs, int rowNum) throws SQLException {
        return new Label(
                new LabelRef(rs.getString("namespace"), rs.getString("label_key")),
                rs.getString("category"),
                Locale.forLanguageTag(rs.getString("default_locale")),
                rs.getString("default_text"),
                List.of());
    }

    private LocalizedLabel mapVariant(ResultSet rs, int rowNum) throws SQLException {
        String connector = rs.getString("connector_type");
        String iface = rs.getString("interface_type");
        VariantSlot slot = new VariantSlot(
                Locale.forLanguageTag(rs.getString("locale")),
                connector == null || connector.isEmpty() ? null : connector,
                iface == null || iface.isEmpty() ? null : InterfaceType.valueOf(iface));
        return new LocalizedLabel(slot, readAlternatives(rs.getString("alternatives")), rs.getBoolean("validated"));
    }

    private static MapSqlParameterSource refParams(LabelRef ref) {
        return new MapSqlParameterSource()
                .addValue("namespace", ref.namespace())
                .addValue("key", ref.key());
    }

    private static MapSqlParameterSource labelParams(Label label) {
        return refParams(label.ref())
                .addValue("category", label.category())
                .addValue("defaultLocale", label.defaultLocale().toLanguageTag())
                .addValue("defaultText", label.defaultText());
    }

    private static MapSqlParameterSource slotParams(LabelRef ref, VariantSlot slot) {
        return refParams(ref)
                .addValue("locale", slot.locale().toLanguageTag())
                .addValue("connectorType", slot.connectorType() == null ? ANY : slot.connectorType())
                .addValue("interfaceType", slot.interfaceType() == null ? ANY : slot.interfaceType().name());
    }

    private static MapSqlParameterSource variantParams(LabelRef ref, LocalizedLabel variant) {
        return slotParams(ref, variant.slot())
                .addValue("alternatives", writeAlternatives(variant.alternatives()))
                .addValue("validated", variant.validated());
    }

    private static String writeAlternatives(List<String> alternatives) {
        try {
            return JSON.writeValueAsString(alternatives);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alternatives", e);
        }
    }

    private static List<String> readAlternatives(String json) {
        try {
            return JSON.readValue(json, ALTERNATIVES);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed alternatives column: " + json, e);
        }
    }

    /**
     * 各数据库的建表语句。
     *
     * <p>Key 格式：{dbType}:{tableName}，如 "h2:i18n_label"、"mysql:i18n_label_variant"
     */
    private static final Map<String, String> SQL_TEMPLATES = Map.of(
            // H2 数据库
            "h2:i18n_label", """
                    CREATE TABLE IF NOT EXISTS i18n_label (
                        id             BIGINT AUTO_INCREMENT PRIMARY KEY,
                        namespace      VARCHAR(128) NOT NULL,
                        label_key      VARCHAR(255) NOT NULL,
                        category       VARCHAR(128),
                        default_locale VARCHAR(35)  NOT NULL,
                        default_text   VARCHAR(4000) NOT NULL,
                        updated_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                        created_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                        CONSTRAINT uk_label UNIQUE (namespace, label_key)
                    )
                    """,
            "h2:i18n_label_variant", """
                    CREATE TABLE IF NOT EXISTS i18n_label_variant (
                        id             BIGINT AUTO_INCREMENT PRIMARY KEY,
                        namespace      VARCHAR(128) NOT NULL,
                        label_key      VARCHAR(255) NOT NULL,
                        locale         VARCHAR(35)  NOT NULL,
                        connector_type VARCHAR(64)  DEFAULT '' NOT NULL,
                        interface_type VARCHAR(16)  DEFAULT '' NOT NULL,
                        alternatives   VARCHAR(16000) NOT NULL,
                        validated      BOOLEAN      DEFAULT FALSE,
                        updated_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                        CONSTRAINT uk_variant UNIQUE (namespace, label_key, locale, connector_type, interface_type)
                    )
                    """,
            // MySQL 数据库
            "mysql:i18n_label", """
                    CREATE TABLE IF NOT EXISTS `i18n_label` (
                        `id` BIGINT NOT NULL AUTO_INCREMENT,
                        `namespace` VARCHAR(128) NOT NULL,
                        `label_key` VARCHAR(255) NOT NULL,
                        `category` VARCHAR(128) DEFAULT NULL,
                        `default_locale` VARCHAR(35) NOT NULL,
                        `default_text` TEXT NOT NULL,
                        `updated_at` TIMESTAMP NULL DEFAULT CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP,
                        `created_at` TIMESTAMP NULL DEFAULT CURRENT_TIMESTAMP,
                        PRIMARY KEY (`id`),
                        UNIQUE KEY `uk_label` (`namespace`, `label_key`)
                    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4;
                    """,
            "mysql:i18n_label_variant", """
                    CREATE TABLE IF NOT EXISTS `i18n_label_variant` (
                        `id` BIGINT NOT NULL AUTO_INCREMENT,
                        `namespace` VARCHAR(128) NOT NULL,
                        `label_key` VARCHAR(255) NOT NULL,
                        `locale` VARCHAR(35) NOT NULL,
                        `connector_type` VARCHAR(64) NOT NULL DEFAULT '',
                        `interface_type` VARCHAR(16) NOT NULL DEFAULT '',
                        `alternatives` TEXT NOT NULL,
                        `validated` TINYINT(1) DEFAULT '0',
                        `updated_at` TIMESTAMP NULL DEFAULT CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP,
                        PRIMARY KEY (`id`),
                        UNIQUE KEY `uk_variant` (`namespace`, `label_key`, `locale`, `connector_type`, `interface_type`)
                    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4;
                    """
    );

    /**
     * 确保表结构存在（幂等执行）。
     * <p>建表失败时记录警告但不中断初始化（表可能已存在，或数据库不支持某些语法）。
     */
    private void ensureTables() {
        try {
            DataSource dataSource = getDataSource();
            if (dataSource == null) {
                log.warn("DataSource is null, cannot detect database provider");
                return;
            }
            String url;
            try (var connection = dataSource.getConnection()) {
                url = connection.getMetaData().getURL();
            }
            String dbType = detectDatabaseType(url);
            String labelSql = SQL_TEMPLATES.get(dbType + ":i18n_label");
            String variantSql = SQL_TEMPLATES.get(dbType + ":i18n_label_variant");
            jdbc.getJdbcTemplate().execute(labelSql);
            jdbc.getJdbcTemplate().execute(variantSql);
            log.info("Ensured label tables for database type '{}'", dbType);
        } catch (Exception e) {
            log.warn("Failed to ensure label tables (may already exist).", e);
        }
    }

    /**
     * 根据数据库 URL 检测数据库类型，无法识别时按 MySQL 处理。
     */
    private static String detectDatabaseType(String url) {
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        if (lowerUrl.contains(":h2:")) {
            return "h2";
        }
        return "mysql";
    }

    /**
     * 隐藏 JDBC URL 中的密码信息（用于日志）。
     */
    private static String maskPassword(String url) {
        if (url == null) return null;
        return url.replaceAll("(?i)password=[^;&]+", "password=***");
    }

    private void checkInitialized() {
        if (jdbc == null) {
            String message = "JdbcLabelStore not initialized. Call init() first.";
            log.error(message);
            throw new IllegalStateException(message);
        }
    }

    private static String must(Map<String, String> cfg, String key) {
        return Optional.ofNullable(cfg.get(key))
                .filter(v -> !v.isBlank())
                .orElseThrow(() -> new IllegalArgumentException("Missing required options: " + key));
    }
}

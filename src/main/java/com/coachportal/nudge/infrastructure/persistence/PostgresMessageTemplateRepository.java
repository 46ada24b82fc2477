package com.coachportal.nudge.infrastructure.persistence;

import com.coachportal.nudge.application.port.output.MessageTemplateRepository;
import com.coachportal.nudge.application.port.output.RepositoryException;
import com.coachportal.nudge.domain.model.MessageTemplate;
import com.coachportal.nudge.domain.model.NudgeCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.Map;

/**
 * PostgreSQL implementation of MessageTemplateRepository (nudge_templates).
 *
 * message_blocks is stored as {"blocks": [...]}; a bare block array is accepted too.
 * Rows for unknown types or without a usable block array are skipped with a
 * warning, and the renderer then uses the built-in skeleton.
 */
public final class PostgresMessageTemplateRepository implements MessageTemplateRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresMessageTemplateRepository.class);

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    public PostgresMessageTemplateRepository(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    @Override
    public Map<NudgeCategory, MessageTemplate> loadDefaults() {
        String sql = """
                SELECT nudge_type, message_blocks::text AS message_blocks
                FROM nudge_templates
                WHERE is_default = true
                ORDER BY created_at
                """;

        Map<NudgeCategory, MessageTemplate> templates = new EnumMap<>(NudgeCategory.class);
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                String type = rs.getString("nudge_type");
                NudgeCategory category;
                try {
                    category = NudgeCategory.fromWire(type);
                } catch (IllegalArgumentException e) {
                    log.debug("Ignoring template for unsupported type {}", type);
                    continue;
                }

                String stored = rs.getString("message_blocks");
                if (stored == null) {
                    log.warn("Template for {} has no blocks, ignoring", type);
                    continue;
                }
                try {
                    ArrayNode blocks = blockArray(mapper.readTree(stored));
                    if (blocks == null) {
                        log.warn("Template for {} has no block array, ignoring", type);
                        continue;
                    }
                    // later rows win
                    templates.put(category, new MessageTemplate(category, blocks));
                } catch (JsonProcessingException e) {
                    log.warn("Template for {} is not valid JSON, ignoring: {}", type, e.getOriginalMessage());
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load templates: {}", e.getMessage());
            throw new RepositoryException("Failed to load templates", e);
        }
        return templates;
    }

    static ArrayNode blockArray(JsonNode stored) {
        if (stored == null) {
            return null;
        }
        JsonNode blocks = stored.isObject() ? stored.get("blocks") : stored;
        return blocks != null && blocks.isArray() && !blocks.isEmpty() ? (ArrayNode) blocks : null;
    }
}

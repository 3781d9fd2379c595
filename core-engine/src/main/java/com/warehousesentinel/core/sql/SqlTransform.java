package com.warehousesentinel.core.sql;

import com.warehousesentinel.core.model.DefinitionException;
import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.model.SourceRef;
import com.warehousesentinel.core.model.TransformQueryBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transform given as literal SQL in the definition.
 *
 * <p>
 * The text may reference the entity's sources as {@code ${source.<id>}},
 * which expands to the back-quoted {@code `dataset.table`} of that source.
 * </p>
 *
 * @since 1.0.0
 */
public final class SqlTransform implements TransformQueryBuilder {

    private static final Pattern SOURCE_REF = Pattern.compile("\\$\\{source\\.([A-Za-z0-9_\\-]+)}");

    private final String sql;

    public SqlTransform(String sql) {
        Objects.requireNonNull(sql, "Transform SQL must not be null");
        if (sql.isBlank()) {
            throw new DefinitionException("Transform SQL must not be blank");
        }
        this.sql = sql.trim();
    }

    @Override
    public String buildQuery(Entity entity) {
        Matcher matcher = SOURCE_REF.matcher(sql);
        StringBuilder out = new StringBuilder();
        List<String> unknown = new ArrayList<>();
        while (matcher.find()) {
            String sourceId = matcher.group(1);
            String replacement = entity.getSources().stream()
                    .filter(source -> source.id().equals(sourceId))
                    .findFirst()
                    .map(SourceRef::fqn)
                    .map(fqn -> "`" + fqn + "`")
                    .orElse(null);
            if (replacement == null) {
                unknown.add("unknown source '" + sourceId + "'");
                replacement = matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        DefinitionException.throwIfAny("Transform of entity '" + entity.getId() + "' references", unknown);
        return out.toString();
    }

    public String getSql() {
        return sql;
    }
}

package com.warehousesentinel.core.report;

import com.warehousesentinel.core.model.Entity;
import com.warehousesentinel.core.sql.EntityMaterializer;
import com.warehousesentinel.core.warehouse.QueryExecutionException;
import com.warehousesentinel.core.warehouse.WarehouseGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds an entity table from its sources with a full-replace DDL.
 *
 * @since 1.0.0
 */
public final class EntityExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(EntityExecutor.class);

    private final WarehouseGateway gateway;
    private final EntityMaterializer materializer;
    private final Duration queryTimeout;

    public EntityExecutor(WarehouseGateway gateway, Duration queryTimeout) {
        this(gateway, new EntityMaterializer(), queryTimeout);
    }

    public EntityExecutor(WarehouseGateway gateway, EntityMaterializer materializer, Duration queryTimeout) {
        this.gateway = Objects.requireNonNull(gateway, "Gateway must not be null");
        this.materializer = Objects.requireNonNull(materializer, "Materializer must not be null");
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "Query timeout must not be null");
    }

    /**
     * @param entity entity to materialize
     * @throws QueryExecutionException if the DDL fails; the DDL text is
     *                                 attached
     */
    public void materialize(Entity entity) {
        Objects.requireNonNull(entity, "Entity must not be null");
        String ddl = materializer.buildMaterializeDdl(entity);
        LOG.debug("Entity [{}] DDL:\n{}", entity.getId(), ddl);
        try {
            gateway.executeQuery(ddl, Map.of(), queryTimeout);
        } catch (QueryExecutionException e) {
            throw QueryExecutionException.withSql(e, ddl);
        }
        LOG.info("Entity [{}] materialized into {}", entity.getId(), entity.fqn());
    }
}

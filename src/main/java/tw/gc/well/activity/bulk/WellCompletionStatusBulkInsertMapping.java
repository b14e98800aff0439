package tw.gc.well.activity.bulk;

import de.bytefish.pgbulkinsert.mapping.AbstractMapping;
import tw.gc.well.activity.entities.WellCompletionStatus;

/**
 * PgBulkInsert mapping for WellCompletionStatus.
 */
public class WellCompletionStatusBulkInsertMapping extends AbstractMapping<WellCompletionStatus> {

    public WellCompletionStatusBulkInsertMapping() {
        super("public", "well_completion_status");

        mapLong("operation_id", WellCompletionStatus::getOperationId);
        mapVarChar("well_name", WellCompletionStatus::getWellName);
        mapVarChar("completion_name", WellCompletionStatus::getCompletionName);
        mapVarChar("reservoir", WellCompletionStatus::getReservoir);
        mapInteger("year", WellCompletionStatus::getYear);
        mapInteger("month", WellCompletionStatus::getMonth);
        mapBoolean("is_active", WellCompletionStatus::isActive);
        mapVarChar("well_type", c -> c.getWellType().name());
        mapDouble("oil_rate", c -> c.getOilRate() != null ? c.getOilRate() : 0.0);
        mapDouble("water_rate", c -> c.getWaterRate() != null ? c.getWaterRate() : 0.0);
        mapDouble("water_inj_rate", c -> c.getWaterInjRate() != null ? c.getWaterInjRate() : 0.0);
    }
}

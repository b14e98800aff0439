package tw.gc.well.activity.bulk;

import de.bytefish.pgbulkinsert.mapping.AbstractMapping;
import tw.gc.well.activity.entities.WellMonthlyType;

/**
 * PgBulkInsert mapping for WellMonthlyType.
 * Uses PostgreSQL COPY protocol; the id column is left to its identity default.
 */
public class WellMonthlyTypeBulkInsertMapping extends AbstractMapping<WellMonthlyType> {

    public WellMonthlyTypeBulkInsertMapping() {
        super("public", "well_monthly_type");

        mapLong("operation_id", WellMonthlyType::getOperationId);
        mapVarChar("well_name", WellMonthlyType::getWellName);
        mapInteger("year", WellMonthlyType::getYear);
        mapInteger("month", WellMonthlyType::getMonth);
        mapVarChar("well_type", w -> w.getWellType().name());
        mapDouble("oil_rate", w -> w.getOilRate() != null ? w.getOilRate() : 0.0);
        mapDouble("water_rate", w -> w.getWaterRate() != null ? w.getWaterRate() : 0.0);
        mapDouble("water_inj_rate", w -> w.getWaterInjRate() != null ? w.getWaterInjRate() : 0.0);
        mapBoolean("has_dual_function", WellMonthlyType::isHasDualFunction);
        mapVarChar("remarks", w -> w.getRemarks() != null ? w.getRemarks() : "");
    }
}

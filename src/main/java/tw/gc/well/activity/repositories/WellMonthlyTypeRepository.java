package tw.gc.well.activity.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.well.activity.entities.WellMonthlyType;

import java.util.List;

@Repository
public interface WellMonthlyTypeRepository extends JpaRepository<WellMonthlyType, Long> {

    List<WellMonthlyType> findByOperationIdOrderByWellNameAscYearAscMonthAsc(Long operationId);

    long countByOperationId(Long operationId);

    @Modifying
    @Query("DELETE FROM WellMonthlyType w WHERE w.operationId = :operationId")
    int deleteByOperationId(@Param("operationId") Long operationId);
}

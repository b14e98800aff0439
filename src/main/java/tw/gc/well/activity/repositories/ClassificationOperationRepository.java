package tw.gc.well.activity.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.well.activity.entities.ClassificationOperation;
import tw.gc.well.activity.enums.OperationStatus;

import java.util.List;
import java.util.Optional;

@Repository
public interface ClassificationOperationRepository extends JpaRepository<ClassificationOperation, Long> {

    Optional<ClassificationOperation> findByOperationName(String operationName);

    boolean existsByOperationName(String operationName);

    List<ClassificationOperation> findAllByOrderByCreatedAtDescIdDesc();

    Optional<ClassificationOperation> findFirstByOperationNameOrderByCreatedAtDescIdDesc(String operationName);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ClassificationOperation o SET o.status = :status WHERE o.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") OperationStatus status);
}

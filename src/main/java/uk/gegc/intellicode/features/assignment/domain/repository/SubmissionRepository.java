package uk.gegc.intellicode.features.assignment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.intellicode.features.assignment.domain.model.Submission;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
public interface SubmissionRepository extends JpaRepository<Submission, UUID> {

    Optional<Submission> findByAssignmentIdAndStudentId(UUID assignmentId, UUID studentId);

    List<Submission> findAllByAssignmentIdAndStudentIdOrderBySubmittedAtDesc(UUID assignmentId, UUID studentId);

    List<Submission> findAllByAssignmentIdOrderBySubmittedAtDesc(UUID assignmentId);

    long countByAssignmentIdAndStudentId(UUID assignmentId, UUID studentId);

    boolean existsByAssignmentId(UUID assignmentId);

    @Query("""
            SELECT s.assignmentId FROM Submission s
            WHERE s.studentId = :studentId AND s.assignmentId IN :assignmentIds
            """)
    Set<UUID> findSubmittedAssignmentIds(@Param("studentId") UUID studentId,
                                         @Param("assignmentIds") Collection<UUID> assignmentIds);
}

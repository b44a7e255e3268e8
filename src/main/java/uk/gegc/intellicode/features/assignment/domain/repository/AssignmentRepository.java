package uk.gegc.intellicode.features.assignment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.intellicode.features.assignment.domain.model.Assignment;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssignmentRepository extends JpaRepository<Assignment, UUID> {

    @Query("""
            SELECT a FROM Assignment a
            JOIN FETCH a.module m
            JOIN FETCH m.course
            WHERE a.id = :id
            """)
    Optional<Assignment> findWithCourseById(@Param("id") UUID id);

    @Query("""
            SELECT DISTINCT a FROM Assignment a
            JOIN FETCH a.module m
            JOIN FETCH m.course
            LEFT JOIN FETCH a.questions
            WHERE a.id = :id AND a.published = true
            """)
    Optional<Assignment> findPublishedWithQuestionsById(@Param("id") UUID id);

    List<Assignment> findAllByModuleIdOrderByCreatedAtAsc(UUID moduleId);
}

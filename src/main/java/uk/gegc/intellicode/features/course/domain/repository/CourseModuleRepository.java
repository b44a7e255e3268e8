package uk.gegc.intellicode.features.course.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.intellicode.features.course.domain.model.CourseModule;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CourseModuleRepository extends JpaRepository<CourseModule, UUID> {

    @Query("""
            SELECT m FROM CourseModule m
            JOIN FETCH m.course
            WHERE m.id = :id
            """)
    Optional<CourseModule> findWithCourseById(@Param("id") UUID id);
}

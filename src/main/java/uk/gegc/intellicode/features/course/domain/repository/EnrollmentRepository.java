package uk.gegc.intellicode.features.course.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.intellicode.features.course.domain.model.Enrollment;
import uk.gegc.intellicode.features.course.domain.model.EnrollmentStatus;

import java.util.UUID;

@Repository
public interface EnrollmentRepository extends JpaRepository<Enrollment, UUID> {

    boolean existsByCourseIdAndStudentIdAndStatus(UUID courseId, UUID studentId, EnrollmentStatus status);
}

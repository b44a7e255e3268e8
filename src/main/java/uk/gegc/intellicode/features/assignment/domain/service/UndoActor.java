package uk.gegc.intellicode.features.assignment.domain.service;

import java.util.UUID;

/**
 * Who is asking to undo a submission.
 *
 * @param userId      the caller
 * @param teacher     whether the caller acts as an instructor
 * @param courseOwner whether the caller is the instructor of the assignment's course
 */
public record UndoActor(UUID userId, boolean teacher, boolean courseOwner) {
}

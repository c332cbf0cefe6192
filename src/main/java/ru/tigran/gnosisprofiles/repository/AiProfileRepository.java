package ru.tigran.gnosisprofiles.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.gnosisprofiles.model.AiProfile;

import java.util.Optional;

@Repository
public interface AiProfileRepository extends JpaRepository<AiProfile, Long> {

    /**
     * Looks up the AI profile generated for a piece of content.
     * Unique by the uk_ais_content_id constraint.
     *
     * @param contentId ID of the source content
     * @return Optional with the profile, empty if none was generated yet
     */
    Optional<AiProfile> findByContentId(Long contentId);

}

package ru.tigran.gnosisprofiles.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.gnosisprofiles.model.User;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
}

package com.aiinpocket.rewards.repository;

import com.aiinpocket.rewards.model.entity.AppUser;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    /** 鎖定使用者列（SELECT ... FOR UPDATE），修改餘額前必須先取得 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM AppUser u WHERE u.id = :id")
    Optional<AppUser> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT u.id FROM AppUser u ORDER BY u.id")
    List<Long> findAllIds();

    /** 所有創作者與教師（每日等級重算一律包含） */
    @Query("SELECT u.id FROM AppUser u WHERE u.contentCreator = true OR u.teacher = true ORDER BY u.id")
    List<Long> findCreatorAndTeacherIds();
}

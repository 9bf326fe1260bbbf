package com.aiinpocket.studyquest.repository;

import com.aiinpocket.studyquest.model.entity.AppUser;
import com.aiinpocket.studyquest.model.enums.Tier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    /** 結算寫入時鎖定使用者列，避免同一使用者的兩個 session 同時累加 XP */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM AppUser u WHERE u.id = :id")
    Optional<AppUser> findByIdForUpdate(@Param("id") UUID id);

    /** 降級排程：只需檢查非 BRONZE 的使用者 */
    List<AppUser> findByTierIn(Collection<Tier> tiers);

    /** 排行榜候選（依 XP 取前 100，再於應用層依綜合分數排序） */
    List<AppUser> findTop100ByOrderByTotalXpDescCurrentStreakDesc();
}

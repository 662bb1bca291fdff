package com.kickoff.tipping.repository;

import com.kickoff.tipping.model.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    // Accounts that existed when the fixture locked
    @Query("select u from AppUser u where u.createdAt <= :deadline and (:includeAdmin = true or u.admin = false) " +
            "and (:userId is null or u.id = :userId) order by u.id asc")
    List<AppUser> findAutoTipEligible(@Param("deadline") Instant lockDeadline,
                                      @Param("includeAdmin") boolean includeAdmin,
                                      @Param("userId") Long userId);

    List<AppUser> findByAdminFalseOrderByDisplayNameAsc();

    List<AppUser> findAllByOrderByDisplayNameAsc();
}

package com.opsdash.realtimeservice.repository;

import com.opsdash.realtimeservice.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    // broadcast recipients
    List<UserAccount> findByIsActiveTrue();
}

package com.flagship.account_service.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

    List<AccountEntity> findByNameOrderByIdAsc(String name);

    List<AccountEntity> findAllByOrderByIdAsc();
}

package com.tony.transferMarket.repository;

import com.tony.transferMarket.model.Transaction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    List<Transaction> findByTeamIdOrderByIdDesc(Long teamId);

    List<Transaction> findBySaveId(Long saveId);
}

package com.tony.transferMarket.repository;

import com.tony.transferMarket.model.TransferRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TransferRecordRepository extends JpaRepository<TransferRecord, String> {

    List<TransferRecord> findBySaveIdOrderByDateDesc(Long saveId);

    List<TransferRecord> findByPlayerId(Long playerId);
}

package com.cardledger.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.cardledger.backend.entities.StatementTransaction;

public interface StatementTransactionRepository extends JpaRepository<StatementTransaction, Long> {

    @Query("select case when count(t) > 0 then true else false end from StatementTransaction t "
            + "where t.transactionDate = :date and t.description = :description "
            + "and t.amount > :low and t.amount < :high")
    boolean existsExactMatch(
            @Param("date") LocalDate date,
            @Param("description") String description,
            @Param("low") BigDecimal low,
            @Param("high") BigDecimal high);

    @Query("select case when count(t) > 0 then true else false end from StatementTransaction t "
            + "where t.transactionDate = :date "
            + "and t.amount > :low and t.amount < :high")
    boolean existsSoftMatch(
            @Param("date") LocalDate date,
            @Param("low") BigDecimal low,
            @Param("high") BigDecimal high);

    @Query("select t from StatementTransaction t join fetch t.statement s "
            + "order by t.transactionDate desc")
    List<StatementTransaction> findAllWithStatement();
}

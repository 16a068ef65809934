package com.cardledger.backend.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import com.cardledger.backend.entities.Statement;

public interface StatementRepository extends JpaRepository<Statement, Long> {

    // Narrowing only: callers must still compare the split hash list element by element.
    List<Statement> findByFileHashContaining(String fileHash);

    @EntityGraph(attributePaths = "transactions")
    List<Statement> findByPeriod(String period);

    List<Statement> findAllByOrderByImportedAtDesc();

    @Query("select s.issuer from Statement s "
            + "where s.issuer is not null and trim(s.issuer) <> '' "
            + "group by s.issuer "
            + "order by max(s.importedAt) desc")
    List<String> findIssuersByMostRecentImport();
}

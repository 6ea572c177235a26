package org.nowstart.rightside.repository;

import org.nowstart.rightside.data.entity.PriceBar;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDateTime;
import java.util.List;

public interface PriceBarRepository extends JpaRepository<PriceBar, PriceBar.PriceBarKey> {

    List<PriceBar> findByIdSymbolOrderByIdTsAsc(String symbol);

    List<PriceBar> findByIdSymbolAndIdTsBetweenOrderByIdTsAsc(String symbol, LocalDateTime from, LocalDateTime to);

    List<PriceBar> findByIdSymbolAndIdTsGreaterThanEqualOrderByIdTsAsc(String symbol, LocalDateTime from);

    List<PriceBar> findByIdSymbolAndIdTsLessThanEqualOrderByIdTsAsc(String symbol, LocalDateTime to);

    @Query("select distinct p.id.symbol from PriceBar p order by p.id.symbol")
    List<String> findDistinctSymbols();
}

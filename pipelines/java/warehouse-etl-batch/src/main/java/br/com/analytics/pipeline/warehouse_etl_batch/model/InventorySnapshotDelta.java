package br.com.analytics.pipeline.warehouse_etl_batch.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record InventorySnapshotDelta(
        Long idEstoque,
        Integer idTempo,
        Long idLoja,
        Long idProduto,
        Integer quantidadeInicial,
        Integer quantidadeFinal,
        Integer deltaQuantidade,
        Integer entradas,
        Integer saidas,
        BigDecimal valorEstoqueInicial,
        BigDecimal valorEstoqueFinal,
        LocalDateTime dataCarga
) {
}

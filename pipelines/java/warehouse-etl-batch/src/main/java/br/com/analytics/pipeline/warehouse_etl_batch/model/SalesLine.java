package br.com.analytics.pipeline.warehouse_etl_batch.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record SalesLine(
        Long idVenda,
        Integer numeroItem,
        Integer idTempo,
        Long idLoja,
        Long idCliente,
        Long idProduto,
        Integer quantidade,
        BigDecimal valorUnitario,
        BigDecimal custoUnitario,
        BigDecimal valorTotal,
        BigDecimal custoTotal,
        BigDecimal lucro,
        BigDecimal margemLucro,
        LocalDateTime dataCarga
) {
}

package br.com.analytics.pipeline.warehouse_etl_batch.model;

import java.time.LocalDateTime;

public record DistributionLine(
        Long idDistribuicao,
        Integer numeroItem,
        Long idLojaOrigem,
        Long idLojaDestino,
        Integer idTempo,
        Long idProduto,
        Integer quantidade,
        String status,
        LocalDateTime dataCarga
) {
}

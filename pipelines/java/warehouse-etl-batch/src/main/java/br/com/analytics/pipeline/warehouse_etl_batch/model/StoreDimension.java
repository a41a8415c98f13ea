package br.com.analytics.pipeline.warehouse_etl_batch.model;

import java.time.LocalDateTime;

public record StoreDimension(
        Long idLoja,
        String nomeLoja,
        String enderecoLoja,
        LocalDateTime dataCarga
) {
}

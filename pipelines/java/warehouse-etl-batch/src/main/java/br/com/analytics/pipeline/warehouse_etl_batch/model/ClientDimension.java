package br.com.analytics.pipeline.warehouse_etl_batch.model;

import java.time.LocalDateTime;

public record ClientDimension(
        Long idCliente,
        String nomeCliente,
        String cpfCnpj,
        String email,
        String telefone,
        String endereco,
        String tipoCliente,
        LocalDateTime dataCarga
) {
}

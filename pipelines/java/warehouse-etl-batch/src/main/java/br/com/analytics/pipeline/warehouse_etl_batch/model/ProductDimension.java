package br.com.analytics.pipeline.warehouse_etl_batch.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record ProductDimension(
        Long idProduto,
        String nomeProduto,
        String descricaoProduto,
        Long idCategoria,
        BigDecimal precoVenda,
        BigDecimal custoFornecedor,
        Boolean ativo,
        String nomeCategoria,
        String descricaoCategoria,
        LocalDateTime dataCarga
) {
}

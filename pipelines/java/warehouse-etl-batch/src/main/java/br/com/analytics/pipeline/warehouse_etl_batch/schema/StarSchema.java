package br.com.analytics.pipeline.warehouse_etl_batch.schema;

import br.com.analytics.pipeline.warehouse_etl_batch.model.CalendarDay;
import br.com.analytics.pipeline.warehouse_etl_batch.model.ClientDimension;
import br.com.analytics.pipeline.warehouse_etl_batch.model.DistributionLine;
import br.com.analytics.pipeline.warehouse_etl_batch.model.InventorySnapshotDelta;
import br.com.analytics.pipeline.warehouse_etl_batch.model.ProductDimension;
import br.com.analytics.pipeline.warehouse_etl_batch.model.SalesLine;
import br.com.analytics.pipeline.warehouse_etl_batch.model.StoreDimension;

import java.util.List;
import java.util.Optional;

import static br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnType.BIGINT;
import static br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnType.BOOLEAN;
import static br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnType.DATE;
import static br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnType.DECIMAL;
import static br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnType.INTEGER;
import static br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnType.TIMESTAMP;
import static br.com.analytics.pipeline.warehouse_etl_batch.schema.ColumnType.VARCHAR;

/**
 * The analytics star schema: four dimensions and three facts.
 * Silver column names are on the left, warehouse names on the right where they differ.
 */
public final class StarSchema {

    public static final String LOAD_TIMESTAMP = "data_carga";

    public static final TableDefinition<ClientDimension> DIM_CLIENTE = TableDefinition.<ClientDimension>dimension("dim_cliente", "dim_cliente")
            .column("id_cliente", "id_cliente_api", BIGINT, ClientDimension::idCliente)
            .column("nome_cliente", VARCHAR, ClientDimension::nomeCliente)
            .column("cpf_cnpj", VARCHAR, ClientDimension::cpfCnpj)
            .column("email", VARCHAR, ClientDimension::email)
            .column("telefone", VARCHAR, ClientDimension::telefone)
            .column("endereco", VARCHAR, ClientDimension::endereco)
            .column("tipo_cliente", VARCHAR, ClientDimension::tipoCliente)
            .column(LOAD_TIMESTAMP, TIMESTAMP, ClientDimension::dataCarga)
            .naturalKey("id_cliente")
            .loadTimestamp(LOAD_TIMESTAMP)
            .build();

    public static final TableDefinition<ProductDimension> DIM_PRODUTO = TableDefinition.<ProductDimension>dimension("dim_produto", "dim_produto")
            .column("id_produto", "id_produto_api", BIGINT, ProductDimension::idProduto)
            .column("nome_produto", VARCHAR, ProductDimension::nomeProduto)
            .column("descricao_produto", VARCHAR, ProductDimension::descricaoProduto)
            .column("id_categoria", BIGINT, ProductDimension::idCategoria)
            .column("preco_venda", DECIMAL, ProductDimension::precoVenda)
            .column("custo_fornecedor", DECIMAL, ProductDimension::custoFornecedor)
            .column("ativo", BOOLEAN, ProductDimension::ativo)
            .column("nome_categoria", VARCHAR, ProductDimension::nomeCategoria)
            .column("descricao_categoria", VARCHAR, ProductDimension::descricaoCategoria)
            .column(LOAD_TIMESTAMP, TIMESTAMP, ProductDimension::dataCarga)
            .naturalKey("id_produto")
            .loadTimestamp(LOAD_TIMESTAMP)
            .build();

    public static final TableDefinition<StoreDimension> DIM_LOJA = TableDefinition.<StoreDimension>dimension("dim_loja", "dim_loja")
            .column("id_loja", "id_loja_api", BIGINT, StoreDimension::idLoja)
            .column("nome_loja", VARCHAR, StoreDimension::nomeLoja)
            .column("endereco_loja", VARCHAR, StoreDimension::enderecoLoja)
            .column(LOAD_TIMESTAMP, TIMESTAMP, StoreDimension::dataCarga)
            .naturalKey("id_loja")
            .loadTimestamp(LOAD_TIMESTAMP)
            .build();

    // no load timestamp: calendar rows are overwritten on every merge
    public static final TableDefinition<CalendarDay> DIM_TEMPO = TableDefinition.<CalendarDay>dimension("dim_tempo", "dim_tempo")
            .column("id_tempo", INTEGER, CalendarDay::idTempo)
            .column("data_completa", DATE, CalendarDay::dataCompleta)
            .column("ano", INTEGER, CalendarDay::ano)
            .column("mes", INTEGER, CalendarDay::mes)
            .column("dia", INTEGER, CalendarDay::dia)
            .column("trimestre", INTEGER, CalendarDay::trimestre)
            .column("semana", INTEGER, CalendarDay::semana)
            .column("dia_semana", INTEGER, CalendarDay::diaSemana)
            .column("eh_fim_semana", BOOLEAN, CalendarDay::ehFimSemana)
            .naturalKey("id_tempo")
            .build();

    public static final TableDefinition<SalesLine> FATO_VENDAS = TableDefinition.<SalesLine>fact("fato_vendas", "fato_vendas")
            .column("id_venda", "id_venda_api", BIGINT, SalesLine::idVenda)
            .column("numero_item", INTEGER, SalesLine::numeroItem)
            .column("id_tempo", INTEGER, SalesLine::idTempo)
            .column("id_loja", BIGINT, SalesLine::idLoja)
            .column("id_cliente", BIGINT, SalesLine::idCliente)
            .column("id_produto", BIGINT, SalesLine::idProduto)
            .column("quantidade", INTEGER, SalesLine::quantidade)
            .column("valor_unitario", DECIMAL, SalesLine::valorUnitario)
            .column("custo_unitario", DECIMAL, SalesLine::custoUnitario)
            .column("valor_total", DECIMAL, SalesLine::valorTotal)
            .column("custo_total", DECIMAL, SalesLine::custoTotal)
            .column("lucro", DECIMAL, SalesLine::lucro)
            .column("margem_lucro", DECIMAL, SalesLine::margemLucro)
            .column(LOAD_TIMESTAMP, TIMESTAMP, SalesLine::dataCarga)
            .naturalKey("id_venda", "numero_item")
            .loadTimestamp(LOAD_TIMESTAMP)
            .build();

    public static final TableDefinition<InventorySnapshotDelta> FATO_ESTOQUE = TableDefinition.<InventorySnapshotDelta>fact("fato_estoque", "fato_estoque")
            .column("id_estoque", "id_estoque_api", BIGINT, InventorySnapshotDelta::idEstoque)
            .column("id_tempo", INTEGER, InventorySnapshotDelta::idTempo)
            .column("id_loja", BIGINT, InventorySnapshotDelta::idLoja)
            .column("id_produto", BIGINT, InventorySnapshotDelta::idProduto)
            .column("quantidade_inicial", INTEGER, InventorySnapshotDelta::quantidadeInicial)
            .column("quantidade_final", INTEGER, InventorySnapshotDelta::quantidadeFinal)
            .column("delta_quantidade", INTEGER, InventorySnapshotDelta::deltaQuantidade)
            .column("entradas", INTEGER, InventorySnapshotDelta::entradas)
            .column("saidas", INTEGER, InventorySnapshotDelta::saidas)
            .column("valor_estoque_inicial", DECIMAL, InventorySnapshotDelta::valorEstoqueInicial)
            .column("valor_estoque_final", DECIMAL, InventorySnapshotDelta::valorEstoqueFinal)
            .column(LOAD_TIMESTAMP, TIMESTAMP, InventorySnapshotDelta::dataCarga)
            .naturalKey("id_estoque")
            .loadTimestamp(LOAD_TIMESTAMP)
            .build();

    public static final TableDefinition<DistributionLine> FATO_DISTRIBUICOES = TableDefinition.<DistributionLine>fact("fato_distribuicoes", "fato_distribuicoes")
            .column("id_distribuicao", "id_distribuicao_api", BIGINT, DistributionLine::idDistribuicao)
            .column("numero_item", INTEGER, DistributionLine::numeroItem)
            .column("id_loja_origem", BIGINT, DistributionLine::idLojaOrigem)
            .column("id_loja_destino", BIGINT, DistributionLine::idLojaDestino)
            .column("id_tempo", INTEGER, DistributionLine::idTempo)
            .column("id_produto", BIGINT, DistributionLine::idProduto)
            .column("quantidade", INTEGER, DistributionLine::quantidade)
            .column("status_distribuicao", "status", VARCHAR, DistributionLine::status)
            .column(LOAD_TIMESTAMP, TIMESTAMP, DistributionLine::dataCarga)
            .naturalKey("id_distribuicao", "numero_item")
            .loadTimestamp(LOAD_TIMESTAMP)
            .build();

    private static final List<TableDefinition<?>> ALL = List.of(
            DIM_CLIENTE, DIM_PRODUTO, DIM_LOJA, DIM_TEMPO, FATO_VENDAS, FATO_ESTOQUE, FATO_DISTRIBUICOES);

    private StarSchema() {
    }

    public static List<TableDefinition<?>> all() {
        return ALL;
    }

    public static Optional<TableDefinition<?>> byName(String name) {
        return ALL.stream().filter(definition -> definition.name().equals(name)).findFirst();
    }
}

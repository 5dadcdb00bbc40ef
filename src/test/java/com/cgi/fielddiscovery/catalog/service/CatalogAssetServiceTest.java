package com.cgi.fielddiscovery.catalog.service;

import com.cgi.fielddiscovery.catalog.client.CatalogServiceClient;
import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.catalog.model.TableAsset;
import com.cgi.fielddiscovery.catalog.model.TableGroup;
import com.cgi.fielddiscovery.common.exception.CatalogException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogAssetService")
class CatalogAssetServiceTest {

    @Mock
    private CatalogServiceClient catalogClient;

    @InjectMocks
    private CatalogAssetService service;

    private static CatalogColumn column(String name) {
        return CatalogColumn.builder().name(name).dataType("varchar").build();
    }

    private static TableAsset asset(String id, String schema, String table, CatalogColumn... columns) {
        return TableAsset.builder()
                .id(id)
                .schema(schema)
                .tableName(table)
                .embeddedColumns(new ArrayList<>(List.of(columns)))
                .build();
    }

    @Test
    @DisplayName("Groups columns by schema and table, dropping duplicate column names")
    void groupsByTable() {
        when(catalogClient.fetchTableAssets("ds-1", null, null)).thenReturn(List.of(
                asset("a1", "crm", "customers", column("email"), column("name")),
                asset("a2", "crm", "customers", column("email"), column("phone")),
                asset("a3", "sales", "orders", column("total"))));

        List<TableGroup> groups = service.fetchTableGroups("ds-1", null, null);

        assertThat(groups).extracting(TableGroup::getQualifiedName).containsExactly("crm.customers", "sales.orders");
        assertThat(groups.get(0).getColumns()).extracting(CatalogColumn::getName)
                .containsExactly("email", "name", "phone");
        assertThat(groups.get(0).getAssetId()).isEqualTo("a1");
    }

    @Test
    @DisplayName("Fetches columns for assets without embedded ones and skips tables whose detail fails")
    void fetchesMissingColumns() {
        TableAsset bare = asset("a1", "crm", "customers");
        TableAsset broken = asset("a2", "crm", "orders");
        when(catalogClient.fetchTableAssets("ds-1", null, null)).thenReturn(List.of(bare, broken));
        when(catalogClient.fetchTableColumns(bare)).thenReturn(List.of(column("email")));
        when(catalogClient.fetchTableColumns(broken)).thenThrow(new CatalogException("timeout"));

        List<TableGroup> groups = service.fetchTableGroups("ds-1", null, null);

        assertThat(groups).extracting(TableGroup::getQualifiedName).containsExactly("crm.customers");
    }

    @Test
    @DisplayName("Applies the schema and table scope locally")
    void scope() {
        TableAsset outOfScope = asset(null, "crm", "orders");
        when(catalogClient.fetchTableAssets("ds-1", List.of("crm"), List.of("customers"))).thenReturn(List.of(
                asset("a1", "crm", "customers", column("email")),
                outOfScope,
                asset("a3", "hr", "customers", column("ssn"))));

        List<TableGroup> groups = service.fetchTableGroups("ds-1", List.of("crm"), List.of("customers"));

        assertThat(groups).extracting(TableGroup::getQualifiedName).containsExactly("crm.customers");
        verify(catalogClient, never()).fetchTableColumns(any());
    }

    @Test
    @DisplayName("A failing asset listing propagates")
    void listingFailure() {
        when(catalogClient.fetchTableAssets("ds-1", null, null)).thenThrow(new CatalogException("down"));

        assertThatThrownBy(() -> service.fetchTableGroups("ds-1", null, null))
                .isInstanceOf(CatalogException.class);
    }
}

/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.datamesh.client;

import ai.floedb.datamesh.data.DataContainer;
import ai.floedb.datamesh.model.Catalog;
import ai.floedb.datamesh.model.CatalogSearch;
import ai.floedb.datamesh.model.DatasourceMetadata;
import ai.floedb.datamesh.model.Query;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Non-blocking view of a {@link DatameshConnector}. Each call runs the blocking operation on
 * {@code executor} when subscribed, so nothing happens until a subscriber arrives and every
 * subscription repeats the request.
 */
public final class AsyncDatameshConnector {

  private final DatameshConnector delegate;
  private final Executor executor;

  public AsyncDatameshConnector(DatameshConnector delegate) {
    this(delegate, Infrastructure.getDefaultExecutor());
  }

  public AsyncDatameshConnector(DatameshConnector delegate, Executor executor) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public DatameshConnector blocking() {
    return delegate;
  }

  public Uni<Catalog> getCatalog(CatalogSearch search) {
    return Uni.createFrom().item(() -> delegate.getCatalog(search)).runSubscriptionOn(executor);
  }

  public Uni<DatasourceMetadata> getDatasource(String datasourceId) {
    return Uni.createFrom()
        .item(() -> delegate.getDatasource(datasourceId))
        .runSubscriptionOn(executor);
  }

  public Uni<Optional<DataContainer>> loadDatasource(
      String datasourceId, Map<String, Object> parameters, boolean lazy) {
    return Uni.createFrom()
        .item(() -> delegate.loadDatasource(datasourceId, parameters, lazy))
        .runSubscriptionOn(executor);
  }

  public Uni<Optional<DataContainer>> query(Query query) {
    return query(query, QueryOptions.DEFAULT);
  }

  public Uni<Optional<DataContainer>> query(Query query, QueryOptions options) {
    return Uni.createFrom().item(() -> delegate.query(query, options)).runSubscriptionOn(executor);
  }

  public Uni<DatasourceMetadata> writeDatasource(DatasourceWrite write) {
    return Uni.createFrom().item(() -> delegate.writeDatasource(write)).runSubscriptionOn(executor);
  }

  public Uni<DatasourceMetadata> updateMetadata(String datasourceId, DatasourceUpdate update) {
    return Uni.createFrom()
        .item(() -> delegate.updateMetadata(datasourceId, update))
        .runSubscriptionOn(executor);
  }

  public Uni<Boolean> deleteDatasource(String datasourceId) {
    return Uni.createFrom()
        .item(() -> delegate.deleteDatasource(datasourceId))
        .runSubscriptionOn(executor);
  }
}

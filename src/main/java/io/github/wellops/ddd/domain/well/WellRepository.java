/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.wellops.ddd.domain.well;

import io.github.wellops.ddd.domain.AggregateType;
import io.github.wellops.ddd.domain.vo.ApiNumber;
import io.github.wellops.ddd.domain.vo.Coordinates;
import io.github.wellops.ddd.jooq.DslContextProvider;
import io.github.wellops.ddd.jooq.JooqAggregateRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;

/** Stores {@link Well}s in the {@link WellTable}. */
public class WellRepository extends JooqAggregateRepository<Well> {
  public WellRepository(final DslContextProvider dslContextProvider, final Clock clock) {
    super(
        AggregateType.WELL,
        WellTable.TABLE,
        WellTable.ID,
        WellTable.VERSION,
        WellTable.FIELDS,
        dslContextProvider,
        clock);
  }

  @Override
  protected Well fromRecord(final DSLContext dsl, final Record dbRecord) {
    return Well.rehydrate(
        new Well.Snapshot(
            dbRecord.get(WellTable.ID),
            ApiNumber.of(dbRecord.get(WellTable.API_NUMBER)),
            dbRecord.get(WellTable.WELL_NAME),
            dbRecord.get(WellTable.OPERATOR_ID),
            dbRecord.get(WellTable.WELL_TYPE),
            dbRecord.get(WellTable.STATUS),
            new Coordinates(dbRecord.get(WellTable.LATITUDE), dbRecord.get(WellTable.LONGITUDE)),
            dbRecord.get(WellTable.LEASE_ID),
            dbRecord.get(WellTable.SPUD_DATE),
            dbRecord.get(WellTable.COMPLETION_DATE),
            dbRecord.get(WellTable.TOTAL_DEPTH_FT),
            dbRecord.get(WellTable.CREATED_AT),
            dbRecord.get(WellTable.UPDATED_AT),
            dbRecord.get(WellTable.VERSION)),
        clock());
  }

  @Override
  protected Map<Field<?>, Object> toValues(final Well well) {
    final Well.Snapshot snapshot = well.toSnapshot();

    final Map<Field<?>, Object> values = new LinkedHashMap<>();
    values.put(WellTable.API_NUMBER, snapshot.apiNumber().getValue());
    values.put(WellTable.WELL_NAME, snapshot.name());
    values.put(WellTable.OPERATOR_ID, snapshot.operatorId());
    values.put(WellTable.LEASE_ID, snapshot.leaseId());
    values.put(WellTable.WELL_TYPE, snapshot.wellType());
    values.put(WellTable.STATUS, snapshot.status());
    values.put(WellTable.LATITUDE, snapshot.location().latitude());
    values.put(WellTable.LONGITUDE, snapshot.location().longitude());
    values.put(WellTable.SPUD_DATE, snapshot.spudDate());
    values.put(WellTable.COMPLETION_DATE, snapshot.completionDate());
    values.put(WellTable.TOTAL_DEPTH_FT, snapshot.totalDepthFeet());
    values.put(WellTable.CREATED_AT, snapshot.createdAt());
    values.put(WellTable.UPDATED_AT, snapshot.updatedAt());
    return values;
  }
}

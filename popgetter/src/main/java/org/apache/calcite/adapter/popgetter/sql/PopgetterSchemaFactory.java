/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.popgetter.sql;

import org.apache.calcite.adapter.popgetter.Popgetter;
import org.apache.calcite.adapter.popgetter.PopgetterConfig;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Factory for {@link PopgetterSchema}, for use in Calcite models:
 *
 * <pre>{@code
 * {
 *   "name": "POPGETTER",
 *   "type": "custom",
 *   "factory": "org.apache.calcite.adapter.popgetter.sql.PopgetterSchemaFactory",
 *   "operand": {"basePath": "https://...", "useCache": true}
 * }
 * }</pre>
 *
 * <p>Operand keys are those of {@link PopgetterConfig}, plus {@code useCache}
 * to read and write the local metadata cache.
 */
public class PopgetterSchemaFactory implements SchemaFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(PopgetterSchemaFactory.class);

  public static final PopgetterSchemaFactory INSTANCE = new PopgetterSchemaFactory();

  public static final String USE_CACHE = "useCache";

  private PopgetterSchemaFactory() {
  }

  @Override public Schema create(SchemaPlus parentSchema, String name,
      Map<String, Object> operand) {
    PopgetterConfig config = PopgetterConfig.fromOperand(operand);
    boolean useCache = Boolean.parseBoolean(String.valueOf(operand.get(USE_CACHE)));
    LOGGER.info("Creating schema {} over {} (cache {})", name, config.getBasePath(),
        useCache ? "on" : "off");
    Popgetter popgetter = useCache ? Popgetter.createWithCache(config) : Popgetter.create(config);
    return new PopgetterSchema(popgetter);
  }
}

package dev.mars.pgevents.api;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

/**
 * Tenancy style of an event store.
 *
 * <p>{@link #SINGLE} stores every stream under the default tenant.
 * {@link #CONJOINED} keeps all tenants in the same tables and scopes every
 * stream lookup by the session's tenant id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public enum TenancyStyle {
    SINGLE,
    CONJOINED;

    public static final String DEFAULT_TENANT_ID = "*DEFAULT*";
}

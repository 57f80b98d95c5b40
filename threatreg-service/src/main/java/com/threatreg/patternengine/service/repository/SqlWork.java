/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of JDBC work run on a connection owned by {@link TransactionRunner}.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection connection) throws SQLException;
}

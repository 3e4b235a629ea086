package org.alertingupgrade.migrations.store;

@FunctionalInterface
public interface TransactionalWork<T> {
    T execute();
}

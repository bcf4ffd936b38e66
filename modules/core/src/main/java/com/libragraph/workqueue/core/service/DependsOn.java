package com.libragraph.workqueue.core.service;

import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The annotated {@link ManagedService} refuses to start until the named service is
 * {@link ManagedService.State#RUNNING}.
 */
@Target(TYPE)
@Retention(RUNTIME)
@Repeatable(DependsOn.List.class)
public @interface DependsOn {

    Class<? extends ManagedService> value();

    @Target(TYPE)
    @Retention(RUNTIME)
    @interface List {
        DependsOn[] value();
    }
}

package io.confluent.csid.utils;

/*-
 * Copyright (C) 2020-2025 Confluent, Inc.
 */

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import javax.naming.InitialContext;
import javax.naming.NamingException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@UtilityClass
public class ThreadUtils {

    /**
     * Looks up a managed {@link ThreadFactory} for Java EE containers, falling back to plain Java SE threads.
     *
     * @param managedThreadFactory JNDI name of the container's managed thread factory
     * @param namePrefix           prefix for every thread created, followed by a sequence number
     */
    public static ThreadFactory namedThreadFactory(String managedThreadFactory, String namePrefix) {
        ThreadFactory defaultFactory;
        try {
            defaultFactory = InitialContext.doLookup(managedThreadFactory);
        } catch (NamingException e) {
            log.debug("Using Java SE Thread", e);
            defaultFactory = Executors.defaultThreadFactory();
        }
        ThreadFactory finalDefaultFactory = defaultFactory;
        AtomicInteger sequence = new AtomicInteger();
        return r -> {
            Thread thread = finalDefaultFactory.newThread(r);
            thread.setName(namePrefix + "-" + sequence.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}

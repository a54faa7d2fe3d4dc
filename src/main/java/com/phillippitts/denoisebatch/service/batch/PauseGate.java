package com.phillippitts.denoisebatch.service.batch;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gate that paused workers wait on before taking their next job. Once {@link #release()}d it
 * stays open for good.
 */
public final class PauseGate {

    private final Lock lock = new ReentrantLock();
    private final Condition opened = lock.newCondition();
    private boolean paused;
    private boolean released;

    public void pause() {
        lock.lock();
        try {
            if (!released) {
                paused = true;
            }
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            opened.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens the gate permanently, e.g. on stop, so waiting workers can exit.
     */
    public void release() {
        lock.lock();
        try {
            released = true;
            paused = false;
            opened.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while the gate is paused.
     */
    public void awaitOpen() throws InterruptedException {
        lock.lock();
        try {
            while (paused && !released) {
                opened.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }
}

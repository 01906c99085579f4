// This file is part of OpenTSDB.
// Copyright (C) 2022  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.metricsplit.query.execution;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.TimeUnit;

import org.junit.Before;
import org.junit.Test;

import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import io.netty.util.TimerTask;
import io.opentracing.Span;
import net.metricsplit.exceptions.QueryExecutionException;
import net.metricsplit.query.execution.TestQueryExecutor.MockDownstream;

public class TestTimedQueryExecutor extends BaseExecutorTest {
  private QueryExecutor<Long> executor;
  private MockDownstream<Long> downstream;
  
  @SuppressWarnings("unchecked")
  @Before
  public void beforeLocal() throws Exception {
    executor = mock(QueryExecutor.class);
    downstream = new MockDownstream<Long>(request);
    
    when(executor.executeQuery(eq(context), eq(request), any(Span.class)))
      .thenReturn(downstream);
    when(executor.close()).thenReturn(Deferred.<Object>fromResult(null));
  }
  
  @Test
  public void ctor() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    assertEquals("UT", tqe.id());
    assertEquals(1000, tqe.timeout());
    assertTrue(tqe.outstandingRequests().isEmpty());
    assertEquals(1, tqe.downstreamExecutors().size());
    assertSame(executor, tqe.downstreamExecutors().get(0));

    try {
      new TimedQueryExecutor<Long>("UT", null, 1000);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new TimedQueryExecutor<Long>("UT", executor, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new TimedQueryExecutor<Long>(null, executor, 1000);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void execute() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    try {
      exec.deferred().join(1);
      fail("Expected TimeoutException");
    } catch (TimeoutException e) { }
    
    verify(timer, times(1))
      .newTimeout((TimerTask) exec, 1000, TimeUnit.MILLISECONDS);
    verify(timeout, never()).cancel();
    verify(executor, times(1)).executeQuery(context, request, span);
    assertFalse(downstream.cancelled);
    assertTrue(tqe.outstandingRequests().contains(exec));
    
    downstream.callback(42L);
    assertEquals(42L, (long) exec.deferred().join());
    assertFalse(tqe.outstandingRequests().contains(exec));
    verify(timeout, times(1)).cancel();
    assertTrue(downstream.completed());
    assertFalse(downstream.cancelled);
  }
  
  @Test
  public void executeAlreadyClosed() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    assertNull(tqe.close().join());
    verify(executor, times(1)).close();
    
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    try {
      exec.deferred().join();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) { }
    verify(timer, never())
      .newTimeout(any(TimerTask.class), anyLong(), eq(TimeUnit.MILLISECONDS));
    verify(executor, never()).executeQuery(context, request, span);
    assertNotSame(downstream, exec);
    assertFalse(tqe.outstandingRequests().contains(exec));
  }
  
  @Test
  public void executeThrownException() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    when(executor.executeQuery(eq(context), eq(request), any(Span.class)))
      .thenThrow(new IllegalStateException("Boo!"));
    
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    try {
      exec.deferred().join();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) { 
      assertEquals(500, e.getStatusCode());
      assertTrue(e.getCause() instanceof IllegalStateException);
    }
    verify(executor, times(1)).executeQuery(context, request, span);
    // the timer was armed first
    verify(timeout, times(1)).cancel();
    assertFalse(tqe.outstandingRequests().contains(exec));
  }
  
  @Test
  public void executeNullTimer() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    when(context.getTimer()).thenReturn(null);
    
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    try {
      exec.deferred().join();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) { }
    verify(timer, never())
      .newTimeout(any(TimerTask.class), anyLong(), eq(TimeUnit.MILLISECONDS));
    verify(executor, never()).executeQuery(context, request, span);
    assertFalse(tqe.outstandingRequests().contains(exec));
  }
  
  @Test
  public void executeDownstreamException() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    assertTrue(tqe.outstandingRequests().contains(exec));
    
    downstream.callback(new IllegalStateException("Boo!"));
    try {
      exec.deferred().join();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
    assertFalse(tqe.outstandingRequests().contains(exec));
    verify(timeout, times(1)).cancel();
    assertFalse(downstream.cancelled);
    assertTrue(exec.completed());
  }
  
  @Test
  public void executeTimeout() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    assertTrue(tqe.outstandingRequests().contains(exec));
    
    ((TimerTask) exec).run(null);
    try {
      exec.deferred().join();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) { 
      assertEquals(408, e.getStatusCode());
    }
    assertFalse(tqe.outstandingRequests().contains(exec));
    // the timer fired so there is nothing to cancel
    verify(timeout, never()).cancel();
    assertTrue(downstream.cancelled);
    assertTrue(exec.completed());
    
    // a late result is dropped
    downstream.callback(42L);
    
    // double is ok
    ((TimerTask) exec).run(null);
  }
  
  @Test
  public void executeTimeoutAfterSuccess() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    downstream.callback(42L);
    assertEquals(42L, (long) exec.deferred().join());
    verify(timeout, times(1)).cancel();
    
    ((TimerTask) exec).run(null);
    assertFalse(downstream.cancelled);
    assertEquals(42L, (long) exec.deferred().join());
  }
  
  @Test
  public void executeCancel() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    exec.cancel();
    try {
      exec.deferred().join();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) { }
    assertFalse(tqe.outstandingRequests().contains(exec));
    verify(timeout, times(1)).cancel();
    assertTrue(downstream.cancelled);
    assertTrue(exec.completed());
    
    // double is ok
    exec.cancel();
  }
  
  @Test
  public void closeCancelsOutstanding() throws Exception {
    final TimedQueryExecutor<Long> tqe = 
        new TimedQueryExecutor<Long>("UT", executor, 1000);
    final QueryExecution<Long> exec = tqe.executeQuery(context, request, span);
    
    assertNull(tqe.close().join());
    assertTrue(downstream.cancelled);
    try {
      exec.deferred().join();
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) { }
  }
}

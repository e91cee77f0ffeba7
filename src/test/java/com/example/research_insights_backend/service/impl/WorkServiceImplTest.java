package com.example.research_insights_backend.service.impl;

import com.example.research_insights_backend.mapper.WorkMapper;
import com.example.research_insights_backend.model.Work;
import com.example.research_insights_backend.util.RedisUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class WorkServiceImplTest {

    @Mock
    private WorkMapper workMapper;

    @Mock
    private RedisUtil redisUtil;

    @InjectMocks
    private WorkServiceImpl workService;

    private static List<Work> sample() {
        Work work = new Work();
        work.setWorkId("W1");
        return Collections.singletonList(work);
    }

    @Test
    public void testCacheHitSkipsDatabase() {
        List<Work> cached = sample();
        when(redisUtil.getList("works:all", Work.class)).thenReturn(cached);

        assertEquals(cached, workService.getAllWorks());
        verify(workMapper, never()).selectList(any());
    }

    @Test
    public void testCacheMissLoadsDatabaseAndFillsCache() {
        List<Work> rows = sample();
        when(redisUtil.getList("works:all", Work.class)).thenReturn(null);
        when(workMapper.selectList(any())).thenReturn(rows);

        assertEquals(rows, workService.getAllWorks());
        verify(redisUtil).setObject(eq("works:all"), eq(rows), anyLong(), eq(TimeUnit.HOURS));
    }

    @Test
    public void testRedisFailureFallsBackToDatabase() {
        List<Work> rows = sample();
        when(redisUtil.getList("works:all", Work.class))
                .thenThrow(new RedisConnectionFailureException("down"));
        when(workMapper.selectList(any())).thenReturn(rows);
        doThrow(new RedisConnectionFailureException("down"))
                .when(redisUtil).setObject(any(), any(), anyLong(), any());

        assertEquals(rows, workService.getAllWorks());
    }

    @Test
    public void testEvictCacheSwallowsRedisFailure() {
        when(redisUtil.delete("works:all")).thenThrow(new RedisConnectionFailureException("down"));

        workService.evictCache();

        verify(redisUtil).delete("works:all");
    }
}
